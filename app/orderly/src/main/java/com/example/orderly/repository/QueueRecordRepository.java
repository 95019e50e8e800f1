/*
 * どこで: Orderly Repository 層
 * 何を: Location/Ticket の読み出しと、条件付き書き込み(RecordWrite)の組み立てを提供する
 * なぜ: サービス層がキー表記や payload 形式を意識せずに read-compare-write を書けるようにするため
 */
package com.example.orderly.repository;

import com.example.orderly.model.Location;
import com.example.orderly.model.Ticket;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class QueueRecordRepository {

  private final RecordStore recordStore;
  private final QueueRecordCodec codec;

  public Optional<Versioned<Location>> findLocation(String locationId) {
    return recordStore
        .get(RecordKeys.location(locationId))
        .map(record -> new Versioned<>(codec.decodeLocation(record.payload()), record.version()));
  }

  /** 作成時刻順(同時刻は location_id 順)で返す。 */
  public List<Location> findAllLocations() {
    try (Stream<StoredRecord> records = recordStore.listByPrefix(RecordKeys.locationPrefix())) {
      return records
          .map(record -> codec.decodeLocation(record.payload()))
          .sorted(
              Comparator.comparing(Location::createdAt).thenComparing(Location::locationId))
          .toList();
    }
  }

  public Optional<Versioned<Ticket>> findTicket(String locationId, long ticketNumber) {
    return recordStore
        .get(RecordKeys.ticket(locationId, ticketNumber))
        .map(record -> new Versioned<>(codec.decodeTicket(record.payload()), record.version()));
  }

  /** チケット番号の昇順で返す。 */
  public List<Versioned<Ticket>> findTickets(String locationId) {
    try (Stream<StoredRecord> records =
        recordStore.listByPrefix(RecordKeys.ticketPrefix(locationId))) {
      return records
          .map(record -> new Versioned<>(codec.decodeTicket(record.payload()), record.version()))
          .sorted(Comparator.comparingLong(versioned -> versioned.value().ticketNumber()))
          .toList();
    }
  }

  public Optional<Long> findIdempotentTicketNumber(String locationId, String idempotencyKey) {
    return recordStore
        .get(RecordKeys.idempotency(locationId, idempotencyKey))
        .map(record -> codec.decodeIdempotencyMarker(record.payload()));
  }

  public List<Long> commit(List<RecordWrite> writes) {
    return recordStore.commit(writes);
  }

  public RecordWrite createLocation(Location location) {
    return RecordWrite.put(
        RecordKeys.location(location.locationId()),
        codec.encodeLocation(location),
        WriteCondition.absent());
  }

  public RecordWrite updateLocation(Location location, long expectedVersion) {
    return RecordWrite.put(
        RecordKeys.location(location.locationId()),
        codec.encodeLocation(location),
        WriteCondition.version(expectedVersion));
  }

  public RecordWrite deleteLocation(String locationId, long expectedVersion) {
    return RecordWrite.delete(
        RecordKeys.location(locationId), WriteCondition.version(expectedVersion));
  }

  public RecordWrite createTicket(Ticket ticket) {
    return RecordWrite.put(
        RecordKeys.ticket(ticket.locationId(), ticket.ticketNumber()),
        codec.encodeTicket(ticket),
        WriteCondition.absent());
  }

  public RecordWrite updateTicket(Ticket ticket, long expectedVersion) {
    return RecordWrite.put(
        RecordKeys.ticket(ticket.locationId(), ticket.ticketNumber()),
        codec.encodeTicket(ticket),
        WriteCondition.version(expectedVersion));
  }

  public RecordWrite createIdempotencyMarker(
      String locationId, String idempotencyKey, long ticketNumber, Instant now) {
    return RecordWrite.put(
        RecordKeys.idempotency(locationId, idempotencyKey),
        codec.encodeIdempotencyMarker(ticketNumber, now),
        WriteCondition.absent());
  }
}
