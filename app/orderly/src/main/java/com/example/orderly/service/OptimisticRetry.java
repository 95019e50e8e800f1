/*
 * どこで: Orderly Service 層
 * 何を: 条件付き書き込みの競合を、上限回数・指数バックオフ(ジッタ付き)・期限つきで再試行する
 * なぜ: プロセス内ロックを持たずに、並行する操作を最終的にどちらも成功させるため
 */
package com.example.orderly.service;

import com.example.orderly.api.ContentionException;
import com.example.orderly.config.OrderlyRetryProperties;
import com.example.orderly.repository.RecordConflictException;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class OptimisticRetry {

  private static final Logger logger = LoggerFactory.getLogger(OptimisticRetry.class);

  private final OrderlyRetryProperties properties;
  private final QueueMetrics metrics;
  private final Clock clock;
  private final Sleeper sleeper;

  @Autowired
  public OptimisticRetry(OrderlyRetryProperties properties, QueueMetrics metrics, Clock clock) {
    this(properties, metrics, clock, duration -> Thread.sleep(duration.toMillis()));
  }

  @VisibleForTesting
  OptimisticRetry(
      OrderlyRetryProperties properties, QueueMetrics metrics, Clock clock, Sleeper sleeper) {
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  public Instant defaultDeadline() {
    return clock.instant().plus(properties.operationTimeout());
  }

  /**
   * 役割: attempt を RecordConflictException が出なくなるまで再実行する。
   * 動作: 競合ごとにバックオフして再読込からやり直す。回数上限か、次の試行が deadline を越える場合は
   *     ContentionException を送出する。競合以外の例外はそのまま伝播する。deadline が null なら既定期限。
   * 前提: attempt は 1 回の commit で全効果を書き込み、失敗時に副作用を残さないこと。
   */
  public <T> T execute(String operation, Instant deadline, Supplier<T> attempt) {
    final int maxAttempts = Math.max(1, properties.maxAttempts());
    final Instant effectiveDeadline = deadline == null ? defaultDeadline() : deadline;
    for (int attemptNumber = 1; ; attemptNumber++) {
      if (!clock.instant().isBefore(effectiveDeadline)) {
        return exhausted(operation, attemptNumber - 1);
      }
      try {
        return attempt.get();
      } catch (RecordConflictException ex) {
        metrics.recordConflict(operation);
        logger.debug(
            "conditional write conflict operation={} attempt={} key={}",
            operation,
            attemptNumber,
            ex.key());
        if (attemptNumber >= maxAttempts) {
          return exhausted(operation, attemptNumber);
        }
        final Duration backoff = computeBackoffDuration(attemptNumber);
        if (clock.instant().plus(backoff).isAfter(effectiveDeadline)) {
          return exhausted(operation, attemptNumber);
        }
        sleep(operation, attemptNumber, backoff);
      }
    }
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(2.0, attempt - 1);
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = Math.max(jitterMin, properties.backoffJitterMax());
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    return Duration.ofMillis((long) Math.ceil(capped * jitter));
  }

  private void sleep(String operation, int attemptNumber, Duration backoff) {
    try {
      sleeper.sleep(backoff);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      metrics.recordContentionExhausted();
      throw new ContentionException(operation, attemptNumber, ex);
    }
  }

  private <T> T exhausted(String operation, int attempts) {
    metrics.recordContentionExhausted();
    logger.warn("contention retry exhausted operation={} attempts={}", operation, attempts);
    throw new ContentionException(operation, attempts);
  }

  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
