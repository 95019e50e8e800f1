/*
 * どこで: Orderly Service 層
 * 何を: Location の作成/取得/一覧/削除を提供する
 * なぜ: 参照中の Location を消さないという不変条件をストアの条件付き書き込みで守るため
 */
package com.example.orderly.service;

import com.example.orderly.api.LocationInUseException;
import com.example.orderly.api.LocationNotFoundException;
import com.example.orderly.model.Location;
import com.example.orderly.model.Ticket;
import com.example.orderly.repository.QueueRecordRepository;
import com.example.orderly.repository.Versioned;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LocationRegistryService {

  private static final Logger logger = LoggerFactory.getLogger(LocationRegistryService.class);

  private final QueueRecordRepository repository;
  private final OptimisticRetry retry;
  private final Clock clock;

  public Location createLocation(String name) {
    return createLocation(name, null, 0, null);
  }

  public Location createLocation(
      String name, String description, int capacity, String createdBy) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name is required");
    }
    if (capacity < 0) {
      throw new IllegalArgumentException("capacity must not be negative");
    }
    final String trimmedName = name.trim();
    // absent 条件の衝突は UUID 重複時のみなので、新しい ID で取り直す
    final Location created =
        retry.execute(
            "create_location",
            retry.defaultDeadline(),
            () -> {
              final Location location =
                  Location.open(
                      UUID.randomUUID().toString(),
                      trimmedName,
                      description,
                      capacity,
                      createdBy,
                      clock.instant());
              repository.commit(List.of(repository.createLocation(location)));
              return location;
            });
    logger.info(
        "location created locationId={} name={} createdBy={}",
        created.locationId(),
        created.name(),
        created.createdBy());
    return created;
  }

  public Location getLocation(String locationId) {
    return repository
        .findLocation(locationId)
        .map(Versioned::value)
        .orElseThrow(() -> new LocationNotFoundException(locationId));
  }

  public List<Location> listLocations() {
    return repository.findAllLocations();
  }

  public void deleteLocation(String locationId) {
    deleteLocation(locationId, retry.defaultDeadline());
  }

  /**
   * 役割: 未完了チケットのない Location を削除する。
   * 動作: 同じ試行内で読んだ Location のバージョンを条件に削除する。読み取り後の採番/呼び出しは
   *     バージョンを進めるため、削除は競合として再評価される。
   * 前提: 終端状態のチケットは履歴として残す。
   */
  public void deleteLocation(String locationId, Instant deadline) {
    retry.execute(
        "delete_location",
        deadline,
        () -> {
          final Versioned<Location> location =
              repository
                  .findLocation(locationId)
                  .orElseThrow(() -> new LocationNotFoundException(locationId));
          final long openTickets =
              repository.findTickets(locationId).stream()
                  .map(Versioned::value)
                  .map(Ticket::state)
                  .filter(state -> !state.isTerminal())
                  .count();
          if (openTickets > 0) {
            throw new LocationInUseException(locationId, openTickets);
          }
          repository.commit(
              List.of(repository.deleteLocation(locationId, location.version())));
          return null;
        });
    logger.info("location deleted locationId={}", locationId);
  }
}
