package com.conductor.repository;

import com.conductor.model.StatusEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface StatusEventRepository extends JpaRepository<StatusEvent, UUID> {
}
