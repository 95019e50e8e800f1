package com.example.orderly.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class QueueMetrics {

  static final String WAITING_GAUGE = "orderly.queue.waiting";
  static final String STORAGE_PINNED_GAUGE = "orderly.storage.pinned";

  private final MeterRegistry meterRegistry;
  private final Counter ticketIssuedCounter;
  private final Counter contentionExhaustedCounter;
  private final ConcurrentMap<String, AtomicLong> waitingCounts = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Gauge> waitingGauges = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> transitionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> conflictCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> fallbackCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dependencyErrorCounters = new ConcurrentHashMap<>();

  public QueueMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.ticketIssuedCounter =
        Counter.builder("orderly.ticket.issued.total")
            .description("Tickets issued across all locations")
            .register(meterRegistry);
    this.contentionExhaustedCounter =
        Counter.builder("orderly.contention.exhausted.total")
            .description("Operations that gave up after exhausting the retry budget")
            .register(meterRegistry);
  }

  public void recordTicketIssued() {
    ticketIssuedCounter.increment();
  }

  public void recordTransition(String toState) {
    transitionCounters.computeIfAbsent(toState, this::registerTransitionCounter).increment();
  }

  public void recordConflict(String operation) {
    conflictCounters.computeIfAbsent(operation, this::registerConflictCounter).increment();
  }

  public void recordContentionExhausted() {
    contentionExhaustedCounter.increment();
  }

  public void recordStorageFallback(String operation) {
    fallbackCounters.computeIfAbsent(operation, this::registerFallbackCounter).increment();
  }

  public void recordDependencyError(String errorType) {
    dependencyErrorCounters
        .computeIfAbsent(errorType, this::registerDependencyErrorCounter)
        .increment();
  }

  /** ローカル退避へ固定されている間 1 を示すゲージを登録する。 */
  public void bindStoragePinned(AtomicBoolean pinned) {
    Gauge.builder(STORAGE_PINNED_GAUGE, pinned, flag -> flag.get() ? 1.0 : 0.0)
        .description("1 while storage calls are pinned to the local fallback store")
        .register(meterRegistry);
  }

  public void updateWaitingCount(String locationId, long waiting) {
    final AtomicLong value = waitingCounts.computeIfAbsent(locationId, this::registerWaitingGauge);
    value.set(Math.max(0, waiting));
  }

  /** 役割: 指定外の location の待ち人数ゲージを外す。 動作: 削除済み location のゲージが残り続けないようにする。 */
  public void retainWaitingGauges(Set<String> activeLocationIds) {
    for (String locationId : Set.copyOf(waitingCounts.keySet())) {
      if (activeLocationIds.contains(locationId)) {
        continue;
      }
      final Gauge gauge = waitingGauges.remove(locationId);
      if (gauge != null) {
        meterRegistry.remove(gauge);
      }
      waitingCounts.remove(locationId);
    }
  }

  private AtomicLong registerWaitingGauge(String locationId) {
    final AtomicLong value = new AtomicLong(0);
    final Gauge gauge =
        Gauge.builder(WAITING_GAUGE, value, AtomicLong::get)
            .tags(Tags.of("location_id", locationId))
            .register(meterRegistry);
    waitingGauges.put(locationId, gauge);
    return value;
  }

  private Counter registerTransitionCounter(String toState) {
    return Counter.builder("orderly.ticket.transition.total")
        .tags(Tags.of("to", toState))
        .register(meterRegistry);
  }

  private Counter registerConflictCounter(String operation) {
    return Counter.builder("orderly.storage.conflict.total")
        .tags(Tags.of("operation", operation))
        .register(meterRegistry);
  }

  private Counter registerFallbackCounter(String operation) {
    return Counter.builder("orderly.storage.fallback.total")
        .tags(Tags.of("operation", operation))
        .register(meterRegistry);
  }

  private Counter registerDependencyErrorCounter(String errorType) {
    return Counter.builder("orderly.dependency.error.total")
        .tags(Tags.of("type", errorType))
        .register(meterRegistry);
  }
}
