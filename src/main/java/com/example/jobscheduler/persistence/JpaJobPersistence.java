package com.example.jobscheduler.persistence;

import com.example.jobscheduler.domain.enums.JobStatus;
import com.example.jobscheduler.domain.model.ScheduledJob;
import com.example.jobscheduler.domain.repository.JobRepository;
import com.example.jobscheduler.exception.JobPersistenceException;
import com.example.jobscheduler.mapper.JobMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * JPA-backed job persistence.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaJobPersistence implements JobPersistence {

    private final JobRepository jobRepository;
    private final JobMapper jobMapper;

    @Override
    @Transactional
    public void saveJob(ScheduledJob job) {
        try {
            jobRepository.saveAndFlush(jobMapper.toEntity(job));
            log.debug("Persisted job {} with status {}", job.getId(), job.getStatus());
        } catch (DataAccessException e) {
            throw new JobPersistenceException(job.getId(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledJob> loadActiveJobs() {
        try {
            var entities = jobRepository.findByStatusNotOrderByRunAtAscCreatedAtAsc(JobStatus.DONE);
            log.info("Loaded {} active jobs from the database", entities.size());
            return jobMapper.toModels(entities);
        } catch (DataAccessException e) {
            throw new JobPersistenceException("Failed to load active jobs", e);
        }
    }
}
