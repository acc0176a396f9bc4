package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.JobEntity;
import com.example.jobscheduler.domain.enums.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for JobEntity
 */
@Repository
public interface JobRepository extends JpaRepository<JobEntity, UUID> {

    /**
     * Find all jobs not in the given status, oldest run time first.
     * Used at startup with {@link JobStatus#DONE} to rebuild the in-memory state.
     */
    List<JobEntity> findByStatusNotOrderByRunAtAscCreatedAtAsc(JobStatus status);
}
