/*
 * どこで: Orderly Service 層
 * 何を: チケットの状態遷移(call-next/served/cancel)と待ち状況の照会を提供する
 * なぜ: 遷移ルールの検証と書き込みを同じ read-compare-write で行い、逆戻りや二重呼び出しを防ぐため
 */
package com.example.orderly.service;

import com.example.orderly.api.InvalidTicketTransitionException;
import com.example.orderly.api.LocationNotFoundException;
import com.example.orderly.api.TicketNotFoundException;
import com.example.orderly.config.OrderlyProperties;
import com.example.orderly.model.Location;
import com.example.orderly.model.QueueView;
import com.example.orderly.model.Ticket;
import com.example.orderly.model.TicketId;
import com.example.orderly.model.TicketPosition;
import com.example.orderly.model.TicketState;
import com.example.orderly.repository.QueueRecordRepository;
import com.example.orderly.repository.Versioned;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class QueueStateMachine {

  private static final Logger logger = LoggerFactory.getLogger(QueueStateMachine.class);

  private final QueueRecordRepository repository;
  private final OptimisticRetry retry;
  private final QueueMetrics metrics;
  private final OrderlyProperties properties;
  private final Clock clock;

  public Optional<Ticket> callNext(String locationId) {
    return callNext(locationId, retry.defaultDeadline());
  }

  /**
   * 役割: 最小番号の WAITING チケットを CALLED にし、現在呼び出し番号を進める。
   * 動作: チケットと Location の両方をバージョン条件付きで 1 回の commit に含める。
   *     WAITING がなければ何も書かずに empty を返す。
   * 前提: Location が存在しない場合は LocationNotFoundException。
   */
  public Optional<Ticket> callNext(String locationId, Instant deadline) {
    final Optional<Ticket> called =
        retry.execute(
            "call_next",
            deadline,
            () -> {
              final Versioned<Location> location = requireLocation(locationId);
              final Optional<Versioned<Ticket>> next =
                  repository.findTickets(locationId).stream()
                      .filter(versioned -> versioned.value().state() == TicketState.WAITING)
                      .min(Comparator.comparingLong(versioned -> versioned.value().ticketNumber()));
              if (next.isEmpty()) {
                return Optional.<Ticket>empty();
              }
              final Instant now = clock.instant();
              final Ticket ticket = next.get().value().withState(TicketState.CALLED, now);
              repository.commit(
                  List.of(
                      repository.updateTicket(ticket, next.get().version()),
                      repository.updateLocation(
                          location.value().withServing(ticket.ticketNumber(), now),
                          location.version())));
              return Optional.of(ticket);
            });
    called.ifPresentOrElse(
        ticket -> {
          metrics.recordTransition(TicketState.CALLED.name());
          logger.info("ticket called ticketId={}", ticket.ticketId().value());
        },
        () -> logger.debug("call-next found no waiting ticket locationId={}", locationId));
    return called;
  }

  public Ticket markServed(TicketId ticketId) {
    return markServed(ticketId, retry.defaultDeadline());
  }

  public Ticket markServed(TicketId ticketId, Instant deadline) {
    return transition(ticketId, TicketState.SERVED, "mark_served", deadline);
  }

  public Ticket cancel(TicketId ticketId) {
    return cancel(ticketId, retry.defaultDeadline());
  }

  public Ticket cancel(TicketId ticketId, Instant deadline) {
    return transition(ticketId, TicketState.CANCELLED, "cancel", deadline);
  }

  public QueueView queueView(String locationId) {
    final Location location = requireLocation(locationId).value();
    return QueueProjection.view(
        location, loadTickets(locationId), properties.averageServiceTime());
  }

  public List<Ticket> waitingTickets(String locationId) {
    requireLocation(locationId);
    return QueueProjection.waiting(loadTickets(locationId));
  }

  public TicketPosition ticketStatus(TicketId ticketId) {
    final Ticket ticket = requireTicket(ticketId).value();
    return QueueProjection.position(
        ticket, loadTickets(ticketId.locationId()), properties.averageServiceTime());
  }

  private Ticket transition(
      TicketId ticketId, TicketState next, String operation, Instant deadline) {
    final Ticket updated =
        retry.execute(
            operation,
            deadline,
            () -> {
              final Versioned<Ticket> current = requireTicket(ticketId);
              final TicketState from = current.value().state();
              if (!from.canTransitionTo(next)) {
                throw new InvalidTicketTransitionException(ticketId.value(), from, next);
              }
              final Ticket ticket = current.value().withState(next, clock.instant());
              repository.commit(List.of(repository.updateTicket(ticket, current.version())));
              return ticket;
            });
    metrics.recordTransition(next.name());
    logger.info("ticket transitioned ticketId={} state={}", ticketId.value(), next);
    return updated;
  }

  private Versioned<Location> requireLocation(String locationId) {
    return repository
        .findLocation(locationId)
        .orElseThrow(() -> new LocationNotFoundException(locationId));
  }

  private Versioned<Ticket> requireTicket(TicketId ticketId) {
    return repository
        .findTicket(ticketId.locationId(), ticketId.ticketNumber())
        .orElseThrow(() -> new TicketNotFoundException(ticketId.value()));
  }

  private List<Ticket> loadTickets(String locationId) {
    return repository.findTickets(locationId).stream().map(Versioned::value).toList();
  }
}
