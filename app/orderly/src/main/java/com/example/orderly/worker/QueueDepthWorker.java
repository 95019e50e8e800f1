package com.example.orderly.worker;

import com.example.orderly.model.Location;
import com.example.orderly.service.LocationRegistryService;
import com.example.orderly.service.QueueMetrics;
import com.example.orderly.service.QueueStateMachine;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "orderly.worker-enabled", havingValue = "true", matchIfMissing = true)
public class QueueDepthWorker {

  private static final Logger logger = LoggerFactory.getLogger(QueueDepthWorker.class);

  private final QueueMetrics metrics;
  private final LocationRegistryService locationRegistry;
  private final QueueStateMachine stateMachine;

  public QueueDepthWorker(
      QueueMetrics metrics,
      LocationRegistryService locationRegistry,
      QueueStateMachine stateMachine) {
    this.metrics = metrics;
    this.locationRegistry = locationRegistry;
    this.stateMachine = stateMachine;
  }

  @Scheduled(fixedDelayString = "${orderly.worker-poll-interval}")
  public void run() {
    final List<Location> locations;
    try {
      locations = locationRegistry.listLocations();
    } catch (RuntimeException ex) {
      logger.warn("queue depth worker failed to list locations", ex);
      metrics.recordDependencyError("worker_list_locations");
      return;
    }

    final Set<String> active = new HashSet<>();
    for (Location location : locations) {
      active.add(location.locationId());
      try {
        metrics.updateWaitingCount(
            location.locationId(), stateMachine.queueView(location.locationId()).waitingCount());
      } catch (RuntimeException ex) {
        logger.warn("queue depth worker loop failed locationId={}", location.locationId(), ex);
        metrics.recordDependencyError("worker_loop");
      }
    }
    metrics.retainWaitingGauges(active);
  }
}
