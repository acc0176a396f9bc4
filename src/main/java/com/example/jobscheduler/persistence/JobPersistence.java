package com.example.jobscheduler.persistence;

import com.example.jobscheduler.domain.model.ScheduledJob;
import com.example.jobscheduler.exception.JobPersistenceException;

import java.util.List;

/**
 * Durability contract of the scheduler.
 * <p>
 * Implementations must round-trip every job field losslessly.
 */
public interface JobPersistence {

    /**
     * Insert or replace the stored state of a job, keyed by its id.
     *
     * @throws JobPersistenceException if the write fails
     */
    void saveJob(ScheduledJob job);

    /**
     * Load every job whose status is not DONE, ordered by run time.
     * Called once at startup to rebuild the job store and the queue.
     *
     * @throws JobPersistenceException if the read fails
     */
    List<ScheduledJob> loadActiveJobs();
}
