package com.example.jobscheduler.service.executor;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.enums.JobStatus;
import com.example.jobscheduler.domain.model.ScheduledJob;
import com.example.jobscheduler.service.event.JobDeadLetteredEvent;
import com.example.jobscheduler.service.handler.JobExecutionResult;
import com.example.jobscheduler.service.handler.JobHandler;
import com.example.jobscheduler.service.queue.TimeOrderedQueue;
import com.example.jobscheduler.service.store.JobStore;
import com.example.jobscheduler.support.InMemoryJobPersistence;
import com.example.jobscheduler.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobExecutor Tests")
class JobExecutorTest {

    @Mock
    private JobHandler jobHandler;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Captor
    private ArgumentCaptor<JobDeadLetteredEvent> eventCaptor;

    private MutableClock clock;
    private InMemoryJobPersistence persistence;
    private JobStore jobStore;
    private SimpleMeterRegistry meterRegistry;
    private MetricsConfig metricsConfig;
    private JobSchedulerProperties properties;
    private ThreadPoolTaskScheduler timeoutScheduler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        persistence = new InMemoryJobPersistence();
        jobStore = new JobStore(new TimeOrderedQueue(), persistence, clock);
        meterRegistry = new SimpleMeterRegistry();
        metricsConfig = new MetricsConfig(meterRegistry, jobStore);

        properties = new JobSchedulerProperties();
        properties.setWorkerPoolSize(1);
        properties.setWorkerQueueCapacity(1);
        properties.setExecutionTimeoutMs(5000);

        timeoutScheduler = new ThreadPoolTaskScheduler();
        timeoutScheduler.setPoolSize(1);
        timeoutScheduler.initialize();
    }

    @AfterEach
    void tearDown() {
        timeoutScheduler.shutdown();
    }

    private JobExecutor executor(TaskExecutor workerExecutor) {
        return new JobExecutor(jobStore, jobHandler, new FixedDelayRetryPolicy(Duration.ofSeconds(2)), metricsConfig,
                properties, eventPublisher, workerExecutor, timeoutScheduler, clock);
    }

    private ScheduledJob claim(ScheduledJob job) {
        var claimed = jobStore.claimDue(clock.instant()).orElseThrow();
        assertThat(claimed.getId()).isEqualTo(job.getId());
        return claimed;
    }

    @Nested
    @DisplayName("Successful attempts")
    class SuccessTests {

        @Test
        @DisplayName("Should mark a one-off job done")
        void shouldCompleteOneOffJob() throws Exception {
            // Given
            var job = jobStore.create(clock.instant(), "work", false, Duration.ZERO);
            when(jobHandler.execute("work")).thenReturn(JobExecutionResult.success());

            // When
            executor(new SyncTaskExecutor()).run(claim(job));

            // Then
            var stored = jobStore.get(job.getId()).orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(JobStatus.DONE);
            assertThat(stored.getCompletedAt()).isEqualTo(clock.instant());
            assertThat(meterRegistry.counter("job_scheduler_succeeded", "recurring", "false").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should reschedule a recurring job one interval after completion")
        void shouldRescheduleRecurringJob() throws Exception {
            // Given
            var job = jobStore.create(clock.instant(), "tick", true, Duration.ofSeconds(10));
            when(jobHandler.execute("tick")).thenReturn(JobExecutionResult.success());
            var executor = executor(new SyncTaskExecutor());

            // When
            executor.run(claim(job));

            // Then
            var stored = jobStore.get(job.getId()).orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(JobStatus.SCHEDULED);
            assertThat(stored.getRunAt()).isEqualTo(clock.instant().plusSeconds(10));

            // When
            clock.advance(Duration.ofSeconds(10));
            executor.run(claim(job));

            // Then
            assertThat(jobStore.get(job.getId()).orElseThrow().getRunAt()).isEqualTo(clock.instant().plusSeconds(10));
        }

        @Test
        @DisplayName("A recurring job should keep its failure count across successful runs")
        void recurringJobShouldAccumulateFailures() throws Exception {
            // Given
            var job = jobStore.create(clock.instant(), "tick", true, Duration.ofSeconds(10));
            when(jobHandler.execute("tick"))
                    .thenReturn(JobExecutionResult.failure("flaky"))
                    .thenReturn(JobExecutionResult.success())
                    .thenReturn(JobExecutionResult.failure("flaky"))
                    .thenReturn(JobExecutionResult.success())
                    .thenReturn(JobExecutionResult.failure("flaky"))
                    .thenReturn(JobExecutionResult.success())
                    .thenReturn(JobExecutionResult.failure("flaky"));
            var executor = executor(new SyncTaskExecutor());

            // When
            executor.run(claim(job));
            for (var attempt = 2; attempt <= 7; attempt++) {
                clock.advance(Duration.ofSeconds(10));
                executor.run(claim(job));

                if (attempt % 2 == 0) {
                    assertThat(jobStore.get(job.getId()).orElseThrow().getRetries()).isEqualTo(attempt / 2);
                }
            }

            // Then
            var stored = jobStore.get(job.getId()).orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(JobStatus.DEAD);
            assertThat(stored.getRetries()).isEqualTo(4);
            assertThat(jobStore.queueDepth()).isZero();
            verify(jobHandler, times(7)).execute("tick");
        }
    }

    @Nested
    @DisplayName("Failed attempts")
    class FailureTests {

        @Test
        @DisplayName("Should schedule a retry after a failure result")
        void shouldRetryAfterFailure() throws Exception {
            // Given
            var job = jobStore.create(clock.instant(), "work", false, Duration.ZERO);
            when(jobHandler.execute("work")).thenReturn(JobExecutionResult.failure("Service unavailable", "HTTP_503"));

            // When
            executor(new SyncTaskExecutor()).run(claim(job));

            // Then
            var stored = jobStore.get(job.getId()).orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(JobStatus.SCHEDULED);
            assertThat(stored.getRetries()).isEqualTo(1);
            assertThat(stored.getRunAt()).isEqualTo(clock.instant().plusSeconds(2));
            assertThat(stored.getLastError()).isEqualTo("Service unavailable");
            assertThat(meterRegistry.counter("job_scheduler_failures", "error_type", "HTTP_503").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("A thrown exception should count as a failed attempt")
        void exceptionShouldCountAsFailure() throws Exception {
            // Given
            var job = jobStore.create(clock.instant(), "work", false, Duration.ZERO);
            when(jobHandler.execute(anyString())).thenThrow(new IllegalStateException("kaboom"));

            // When
            executor(new SyncTaskExecutor()).run(claim(job));

            // Then
            var stored = jobStore.get(job.getId()).orElseThrow();
            assertThat(stored.getRetries()).isEqualTo(1);
            assertThat(stored.getLastError()).isEqualTo("kaboom");
        }

        @Test
        @DisplayName("An always-failing job should be dead after max retries plus one attempts")
        void shouldDeadLetterAfterRetriesExhausted() throws Exception {
            // Given
            var job = jobStore.create(clock.instant(), "doomed", false, Duration.ZERO);
            when(jobHandler.execute("doomed")).thenReturn(JobExecutionResult.failure("always"));
            var executor = executor(new SyncTaskExecutor());

            // When
            var attempts = 0;
            while (jobStore.get(job.getId()).orElseThrow().getStatus() == JobStatus.SCHEDULED) {
                executor.run(claim(job));
                attempts++;
                clock.advance(Duration.ofSeconds(2));
            }

            // Then
            var stored = jobStore.get(job.getId()).orElseThrow();
            assertThat(attempts).isEqualTo(4);
            assertThat(stored.getStatus()).isEqualTo(JobStatus.DEAD);
            assertThat(stored.getRetries()).isEqualTo(4);
            verify(jobHandler, times(4)).execute("doomed");
            verify(eventPublisher).publishEvent(eventCaptor.capture());
            assertThat(eventCaptor.getValue().attempts()).isEqualTo(4);
            assertThat(eventCaptor.getValue().job().getStatus()).isEqualTo(JobStatus.DEAD);
            assertThat(meterRegistry.counter("job_scheduler_dead_lettered").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should interrupt and fail an attempt that exceeds its timeout")
        void shouldTimeOutLongRunningHandler() throws Exception {
            // Given
            properties.setExecutionTimeoutMs(100);
            var job = jobStore.create(clock.instant(), "slow", false, Duration.ZERO);
            when(jobHandler.execute("slow")).thenAnswer(inv -> {
                Thread.sleep(10_000);
                return JobExecutionResult.success();
            });
            var start = System.nanoTime();

            // When
            executor(new SyncTaskExecutor()).run(claim(job));

            // Then
            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(5_000);
            assertThat(Thread.currentThread().isInterrupted()).isFalse();
            var stored = jobStore.get(job.getId()).orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(JobStatus.SCHEDULED);
            assertThat(stored.getRetries()).isEqualTo(1);
            assertThat(stored.getLastError()).contains("timeout");
            assertThat(meterRegistry.counter("job_scheduler_timeouts").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should keep the outcome in memory when the write fails")
        void shouldKeepOutcomeWhenPersistenceFails() throws Exception {
            // Given
            var job = jobStore.create(clock.instant(), "work", false, Duration.ZERO);
            when(jobHandler.execute("work")).thenReturn(JobExecutionResult.success());
            persistence.failWrites(true);

            // When
            executor(new SyncTaskExecutor()).run(claim(job));

            // Then
            assertThat(jobStore.get(job.getId()).orElseThrow().getStatus()).isEqualTo(JobStatus.DONE);
            assertThat(jobStore.pendingWriteCount()).isEqualTo(1);
            assertThat(meterRegistry.counter("job_scheduler_persistence_failures", "operation", "execution").count())
                    .isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Capacity")
    class CapacityTests {

        @Test
        @DisplayName("Should hand out one slot per worker and backlog entry")
        void shouldBoundReservations() throws Exception {
            // Given
            var executor = executor(new SyncTaskExecutor());

            // When / Then
            assertThat(executor.tryReserve()).isTrue();
            assertThat(executor.tryReserve()).isTrue();
            assertThat(executor.tryReserve()).isFalse();
            assertThat(executor.inFlight()).isEqualTo(2);
            assertThat(executor.awaitCapacity(Duration.ofMillis(10))).isFalse();

            executor.release();
            assertThat(executor.awaitCapacity(Duration.ofMillis(10))).isTrue();
        }

        @Test
        @DisplayName("Should release the slot once the submitted job finishes")
        void shouldReleaseSlotAfterRun() throws Exception {
            // Given
            var job = jobStore.create(clock.instant(), "work", false, Duration.ZERO);
            when(jobHandler.execute("work")).thenReturn(JobExecutionResult.success());
            var executor = executor(new SyncTaskExecutor());
            executor.tryReserve();

            // When
            var submitted = executor.submit(claim(job));

            // Then
            assertThat(submitted).isTrue();
            assertThat(executor.inFlight()).isZero();
            assertThat(executor.awaitIdle(Duration.ofMillis(10))).isTrue();
        }

        @Test
        @DisplayName("Should return a rejected job to the queue")
        void shouldReleaseClaimWhenRejected() throws Exception {
            // Given
            var job = jobStore.create(clock.instant(), "work", false, Duration.ZERO);
            TaskExecutor rejecting = task -> {
                throw new TaskRejectedException("pool shut down");
            };
            var executor = executor(rejecting);
            executor.tryReserve();

            // When
            var submitted = executor.submit(claim(job));

            // Then
            assertThat(submitted).isFalse();
            assertThat(executor.inFlight()).isZero();
            assertThat(jobStore.get(job.getId()).orElseThrow().getStatus()).isEqualTo(JobStatus.SCHEDULED);
            assertThat(jobStore.queueDepth()).isEqualTo(1);
            verify(jobHandler, never()).execute(any());
        }
    }
}
