package com.conductor.repository;

import com.conductor.model.Event;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

/**
 * Database access for changefeed Events.
 *
 * findByReconciledDateIsNull()
 * → SELECT * FROM events WHERE reconciled_date IS NULL
 */
public interface EventRepository extends JpaRepository<Event, String> {

    // Used by the periodic sync: everything still waiting for a handler run
    List<Event> findByReconciledDateIsNull();

    // Used by the periodic sync: garbage-collect rows whose work is done
    @Modifying
    @Query("DELETE FROM Event e WHERE e.reconciledDate IS NOT NULL")
    int deleteAllReconciled();
}
