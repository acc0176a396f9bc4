package com.example.jobscheduler.service.queue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@DisplayName("TimeOrderedQueue Tests")
class TimeOrderedQueueTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private TimeOrderedQueue queue;

    @BeforeEach
    void setUp() {
        queue = new TimeOrderedQueue();
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("Should pop earlier run times first and equal run times in insertion order")
        void shouldPopInRunTimeThenInsertionOrder() {
            // Given
            var a = UUID.randomUUID();
            var b = UUID.randomUUID();
            var c = UUID.randomUUID();
            queue.insert(c, T0.plusSeconds(5));
            queue.insert(a, T0);
            queue.insert(b, T0);

            // When
            var now = T0.plusSeconds(10);

            // Then
            assertThat(queue.popDue(now)).contains(a);
            assertThat(queue.popDue(now)).contains(b);
            assertThat(queue.popDue(now)).contains(c);
            assertThat(queue.popDue(now)).isEmpty();
        }

        @Test
        @DisplayName("Should not return entries that are not yet due")
        void shouldNotReturnFutureEntries() {
            var id = UUID.randomUUID();
            queue.insert(id, T0.plusSeconds(5));

            assertThat(queue.peekDue(T0)).isEmpty();
            assertThat(queue.popDue(T0)).isEmpty();
            assertThat(queue.peekDue(T0.plusSeconds(5))).contains(id);
            assertThat(queue.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Re-inserting an id should replace its previous entry")
        void reinsertShouldSupersede() {
            // Given
            var id = UUID.randomUUID();
            var other = UUID.randomUUID();
            queue.insert(id, T0);
            queue.insert(other, T0.plusSeconds(1));

            // When
            queue.insert(id, T0.plusSeconds(2));

            // Then
            assertThat(queue.size()).isEqualTo(2);
            var now = T0.plusSeconds(10);
            assertThat(queue.popDue(now)).contains(other);
            assertThat(queue.popDue(now)).contains(id);
            assertThat(queue.popDue(now)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Removal")
    class RemovalTests {

        @Test
        @DisplayName("Removed entries should never be returned")
        void removedEntriesShouldBeSkipped() {
            // Given
            var removed = UUID.randomUUID();
            var kept = UUID.randomUUID();
            queue.insert(removed, T0);
            queue.insert(kept, T0.plusSeconds(1));

            // When
            var result = queue.remove(removed);

            // Then
            assertThat(result).isTrue();
            assertThat(queue.contains(removed)).isFalse();
            assertThat(queue.size()).isEqualTo(1);
            assertThat(queue.nextDueTime()).contains(T0.plusSeconds(1));
            assertThat(queue.popDue(T0.plusSeconds(10))).contains(kept);
        }

        @Test
        @DisplayName("Removing an unknown id should report false")
        void removeUnknownShouldReturnFalse() {
            assertThat(queue.remove(UUID.randomUUID())).isFalse();
        }
    }

    @Nested
    @DisplayName("Waiting")
    class WaitingTests {

        @Test
        @DisplayName("Should return immediately when an entry is due")
        void shouldReturnImmediatelyWhenDue() throws InterruptedException {
            queue.insert(UUID.randomUUID(), T0);

            assertThat(queue.awaitDue(T0, Duration.ofMinutes(1))).isTrue();
        }

        @Test
        @DisplayName("Should time out after the maximum wait when nothing is queued")
        void shouldTimeOutWhenEmpty() throws InterruptedException {
            var start = System.nanoTime();

            var due = queue.awaitDue(T0, Duration.ofMillis(50));

            assertThat(due).isFalse();
            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(40);
        }

        @Test
        @DisplayName("Should wake up early when an entry is inserted")
        void shouldWakeOnInsert() {
            // Given
            var waiter = CompletableFuture.supplyAsync(() -> {
                try {
                    queue.awaitDue(T0, Duration.ofMinutes(1));
                    return true;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            });

            // When
            await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> {
                queue.insert(UUID.randomUUID(), T0);
                assertThat(waiter).isDone();
            });

            // Then
            assertThat(waiter.join()).isTrue();
        }
    }
}
