/*
 * どこで: Orderly Service 層
 * 何を: ロケーション単位で欠番・重複のないチケット番号を払い出す
 * なぜ: 採番カウンタの前進とチケット作成を 1 回の条件付き書き込みにまとめ、失敗した試行で番号を消費しないため
 */
package com.example.orderly.service;

import com.example.orderly.api.LocationNotFoundException;
import com.example.orderly.api.TicketNumberExhaustedException;
import com.example.orderly.model.Location;
import com.example.orderly.model.Ticket;
import com.example.orderly.model.TicketId;
import com.example.orderly.model.VisitorDetails;
import com.example.orderly.repository.QueueRecordRepository;
import com.example.orderly.repository.RecordWrite;
import com.example.orderly.repository.Versioned;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TicketAllocator {

  private static final Logger logger = LoggerFactory.getLogger(TicketAllocator.class);
  static final int MAX_IDEMPOTENCY_KEY_LENGTH = 128;

  private final QueueRecordRepository repository;
  private final OptimisticRetry retry;
  private final QueueMetrics metrics;
  private final Clock clock;

  public Ticket issueTicket(String locationId) {
    return issueTicket(locationId, VisitorDetails.anonymous(), null, retry.defaultDeadline());
  }

  public Ticket issueTicket(String locationId, VisitorDetails visitor, String idempotencyKey) {
    return issueTicket(locationId, visitor, idempotencyKey, retry.defaultDeadline());
  }

  /**
   * 役割: 次の番号でチケットを WAITING として発行する。
   * 動作: Location を読み、候補番号 = next_ticket_number として「チケット作成(absent)」と
   *     「カウンタ前進(version)」を同時に commit する。競合時は再読込から再試行する。
   *     idempotencyKey 指定時は同じ commit でマーカーを作り、再送には最初のチケットを返す。
   * 前提: locationId は空でないこと。
   */
  public Ticket issueTicket(
      String locationId, VisitorDetails visitor, String idempotencyKey, Instant deadline) {
    final String normalizedKey = normalizeIdempotencyKey(idempotencyKey);
    final VisitorDetails details = visitor == null ? VisitorDetails.anonymous() : visitor;
    return retry.execute(
        "issue_ticket", deadline, () -> attemptIssue(locationId, details, normalizedKey));
  }

  private Ticket attemptIssue(String locationId, VisitorDetails visitor, String idempotencyKey) {
    if (idempotencyKey != null) {
      final Optional<Ticket> replayed = findReplayedTicket(locationId, idempotencyKey);
      if (replayed.isPresent()) {
        logger.info(
            "ticket issue replayed ticketId={} idempotencyKey={}",
            replayed.get().ticketId().value(),
            idempotencyKey);
        return replayed.get();
      }
    }

    final Versioned<Location> location =
        repository
            .findLocation(locationId)
            .orElseThrow(() -> new LocationNotFoundException(locationId));
    final long candidate = location.value().nextTicketNumber();
    if (candidate == Long.MAX_VALUE) {
      throw new TicketNumberExhaustedException(locationId);
    }

    final Instant now = clock.instant();
    final Ticket ticket = Ticket.issue(locationId, candidate, visitor, now);
    final List<RecordWrite> writes = new ArrayList<>(3);
    writes.add(repository.createTicket(ticket));
    writes.add(
        repository.updateLocation(location.value().withTicketIssued(now), location.version()));
    if (idempotencyKey != null) {
      writes.add(repository.createIdempotencyMarker(locationId, idempotencyKey, candidate, now));
    }
    repository.commit(writes);

    metrics.recordTicketIssued();
    logger.info("ticket issued ticketId={}", ticket.ticketId().value());
    return ticket;
  }

  private Optional<Ticket> findReplayedTicket(String locationId, String idempotencyKey) {
    return repository
        .findIdempotentTicketNumber(locationId, idempotencyKey)
        .map(
            ticketNumber ->
                repository
                    .findTicket(locationId, ticketNumber)
                    .map(Versioned::value)
                    .orElseThrow(
                        () ->
                            new IllegalStateException(
                                "idempotency marker points to missing ticket "
                                    + new TicketId(locationId, ticketNumber).value())));
  }

  private String normalizeIdempotencyKey(String idempotencyKey) {
    if (idempotencyKey == null || idempotencyKey.isBlank()) {
      return null;
    }
    final String trimmed = idempotencyKey.trim();
    if (trimmed.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
      throw new IllegalArgumentException(
          "Idempotency-Key must be at most " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
    }
    return trimmed;
  }
}
