package com.conductor.repository;

import com.conductor.model.Resource;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ResourceRepository extends JpaRepository<Resource, String> {

    // Used by List when the caller scopes to one cluster
    List<Resource> findByConsumerName(String consumerName);

    boolean existsByConsumerName(String consumerName);
}
