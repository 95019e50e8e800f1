package com.example.orderly.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.orderly.api.ContentionException;
import com.example.orderly.api.LocationNotFoundException;
import com.example.orderly.config.OrderlyRetryProperties;
import com.example.orderly.repository.RecordConflictException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OptimisticRetryTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final List<Duration> sleeps = new ArrayList<>();
  private final OrderlyRetryProperties properties =
      new OrderlyRetryProperties(
          4, Duration.ofMillis(10), Duration.ofMillis(40), 1.0, 1.0, Duration.ofSeconds(3));
  private final OptimisticRetry retry =
      new OptimisticRetry(
          properties,
          new QueueMetrics(meterRegistry),
          clock,
          duration -> {
            sleeps.add(duration);
            clock.advance(duration);
          });

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  void returnsImmediatelyWithoutConflict() {
    assertThat(retry.execute("op", retry.defaultDeadline(), () -> "done")).isEqualTo("done");
    assertThat(sleeps).isEmpty();
  }

  @Test
  void retriesConflictsWithExponentialBackoff() {
    final AtomicInteger calls = new AtomicInteger();

    final String result =
        retry.execute(
            "op",
            retry.defaultDeadline(),
            () -> {
              if (calls.incrementAndGet() < 4) {
                throw new RecordConflictException("k");
              }
              return "ok";
            });

    assertThat(result).isEqualTo("ok");
    assertThat(sleeps)
        .containsExactly(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(40));
    assertThat(conflicts()).isEqualTo(3.0);
  }

  @Test
  void givesUpAfterMaxAttempts() {
    final AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(
            () ->
                retry.execute(
                    "issue_ticket",
                    retry.defaultDeadline(),
                    () -> {
                      calls.incrementAndGet();
                      throw new RecordConflictException("k");
                    }))
        .isInstanceOf(ContentionException.class)
        .satisfies(
            ex -> {
              assertThat(((ContentionException) ex).attempts()).isEqualTo(4);
              assertThat(((ContentionException) ex).operation()).isEqualTo("issue_ticket");
            });
    assertThat(calls).hasValue(4);
    assertThat(meterRegistry.get("orderly.contention.exhausted.total").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void stopsEarlyWhenTheNextBackoffWouldPassTheDeadline() {
    final AtomicInteger calls = new AtomicInteger();
    final Instant deadline = clock.instant().plusMillis(25);

    assertThatThrownBy(
            () ->
                retry.execute(
                    "op",
                    deadline,
                    () -> {
                      calls.incrementAndGet();
                      throw new RecordConflictException("k");
                    }))
        .isInstanceOf(ContentionException.class);
    // 10ms 待機後の 2 回目で失敗し、次の 20ms 待機は期限を越えるため打ち切る
    assertThat(calls).hasValue(2);
    assertThat(sleeps).containsExactly(Duration.ofMillis(10));
  }

  @Test
  void expiredDeadlineFailsWithoutAttempting() {
    final AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(
            () -> retry.execute("op", clock.instant(), () -> calls.incrementAndGet()))
        .isInstanceOf(ContentionException.class);
    assertThat(calls).hasValue(0);
  }

  @Test
  void nullDeadlineUsesOperationTimeout() {
    assertThat(retry.execute("op", null, () -> 1)).isEqualTo(1);
  }

  @Test
  void nonConflictFailuresPropagateWithoutRetry() {
    final AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(
            () ->
                retry.execute(
                    "op",
                    retry.defaultDeadline(),
                    () -> {
                      calls.incrementAndGet();
                      throw new LocationNotFoundException("loc");
                    }))
        .isInstanceOf(LocationNotFoundException.class);
    assertThat(calls).hasValue(1);
  }

  @Test
  void backoffIsCappedAndJittered() {
    final OptimisticRetry jittered =
        new OptimisticRetry(
            new OrderlyRetryProperties(
                10, Duration.ofMillis(10), Duration.ofMillis(100), 0.5, 1.5, Duration.ofSeconds(3)),
            new QueueMetrics(meterRegistry),
            clock,
            duration -> {});

    for (int i = 0; i < 50; i++) {
      assertThat(jittered.computeBackoffDuration(1).toMillis()).isBetween(5L, 15L);
      assertThat(jittered.computeBackoffDuration(8).toMillis()).isBetween(50L, 150L);
    }
  }

  @Test
  void interruptedBackoffSurfacesContentionAndKeepsInterruptFlag() {
    final OptimisticRetry interrupted =
        new OptimisticRetry(
            properties,
            new QueueMetrics(meterRegistry),
            clock,
            duration -> {
              throw new InterruptedException("stop");
            });

    assertThatThrownBy(
            () ->
                interrupted.execute(
                    "op",
                    interrupted.defaultDeadline(),
                    () -> {
                      throw new RecordConflictException("k");
                    }))
        .isInstanceOf(ContentionException.class)
        .hasCauseInstanceOf(InterruptedException.class);
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
  }

  private double conflicts() {
    return meterRegistry
        .get("orderly.storage.conflict.total")
        .tag("operation", "op")
        .counter()
        .count();
  }
}
