package com.conductor.service;

/**
 * Receives resource changes from both backends. resourceId is always namespaced.
 */
public interface EventHandler {

    void onCreate(String dataType, String resourceId) throws Exception;

    void onUpdate(String dataType, String resourceId) throws Exception;

    void onDelete(String dataType, String resourceId) throws Exception;
}
