package com.example.orderly.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.orderly.api.InvalidTicketTransitionException;
import com.example.orderly.api.LocationNotFoundException;
import com.example.orderly.api.TicketNotFoundException;
import com.example.orderly.model.QueueView;
import com.example.orderly.model.Ticket;
import com.example.orderly.model.TicketId;
import com.example.orderly.model.TicketPosition;
import com.example.orderly.model.TicketState;
import com.example.orderly.repository.LocalFileRecordStore;
import com.example.orderly.repository.RecordKeys;
import com.example.orderly.repository.StoredRecord;
import com.example.orderly.service.TicketAllocatorTest.InterferingRecordStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class QueueStateMachineTest {

  private final QueueFixture fixture = new QueueFixture();
  private final String locationId = fixture.registry.createLocation("Front desk").locationId();

  @Test
  void walkThroughAFullServiceCycle() {
    fixture.allocator.issueTicket(locationId);
    fixture.allocator.issueTicket(locationId);
    fixture.allocator.issueTicket(locationId);

    final Ticket called = fixture.stateMachine.callNext(locationId).orElseThrow();
    QueueView view = fixture.stateMachine.queueView(locationId);

    assertThat(called.ticketNumber()).isEqualTo(1L);
    assertThat(called.state()).isEqualTo(TicketState.CALLED);
    assertThat(view.currentServingNumber()).isEqualTo(1L);
    assertThat(view.waitingCount()).isEqualTo(2L);
    assertThat(view.calledTicket().ticketNumber()).isEqualTo(1L);

    fixture.stateMachine.markServed(new TicketId(locationId, 1));
    fixture.stateMachine.cancel(new TicketId(locationId, 2));
    final Ticket next = fixture.stateMachine.callNext(locationId).orElseThrow();
    view = fixture.stateMachine.queueView(locationId);

    assertThat(next.ticketNumber()).isEqualTo(3L);
    assertThat(view.currentServingNumber()).isEqualTo(3L);
    assertThat(view.waitingCount()).isZero();
    assertThat(view.servedCount()).isEqualTo(1L);
    assertThat(view.cancelledCount()).isEqualTo(1L);
    assertThat(view.issuedCount()).isEqualTo(3L);
    assertThat(view.estimatedWait()).isEqualTo(Duration.ZERO);
  }

  @Test
  void callNextIsFifoAndSkipsCancelledTickets() {
    for (int i = 0; i < 4; i++) {
      fixture.allocator.issueTicket(locationId);
    }
    fixture.stateMachine.cancel(new TicketId(locationId, 1));
    fixture.stateMachine.cancel(new TicketId(locationId, 3));

    assertThat(fixture.stateMachine.callNext(locationId)).map(Ticket::ticketNumber).hasValue(2L);
    assertThat(fixture.stateMachine.callNext(locationId)).map(Ticket::ticketNumber).hasValue(4L);
  }

  @Test
  void callNextOnEmptyQueueMutatesNothing() {
    final StoredRecord before = fixture.store.get(RecordKeys.location(locationId)).orElseThrow();

    final Optional<Ticket> result = fixture.stateMachine.callNext(locationId);

    assertThat(result).isEmpty();
    assertThat(fixture.store.get(RecordKeys.location(locationId))).hasValue(before);
  }

  @Test
  void callNextOnUnknownLocationIsNotFound() {
    assertThatThrownBy(() -> fixture.stateMachine.callNext("missing"))
        .isInstanceOf(LocationNotFoundException.class);
  }

  @Test
  void illegalTransitionsLeaveStateUnchanged() {
    fixture.allocator.issueTicket(locationId);
    final TicketId ticketId = new TicketId(locationId, 1);

    assertThatThrownBy(() -> fixture.stateMachine.markServed(ticketId))
        .isInstanceOf(InvalidTicketTransitionException.class);
    assertThat(stateOf(ticketId)).isEqualTo(TicketState.WAITING);

    fixture.stateMachine.callNext(locationId);
    fixture.stateMachine.markServed(ticketId);

    assertThatThrownBy(() -> fixture.stateMachine.cancel(ticketId))
        .isInstanceOf(InvalidTicketTransitionException.class);
    assertThatThrownBy(() -> fixture.stateMachine.markServed(ticketId))
        .isInstanceOf(InvalidTicketTransitionException.class);
    assertThat(stateOf(ticketId)).isEqualTo(TicketState.SERVED);
  }

  @Test
  void calledTicketCanBeCancelled() {
    fixture.allocator.issueTicket(locationId);
    fixture.stateMachine.callNext(locationId);

    final Ticket cancelled = fixture.stateMachine.cancel(new TicketId(locationId, 1));

    assertThat(cancelled.state()).isEqualTo(TicketState.CANCELLED);
    assertThat(fixture.stateMachine.queueView(locationId).calledTicket()).isNull();
  }

  @Test
  void transitionsStampStateChangedAt() {
    fixture.allocator.issueTicket(locationId);
    fixture.clock.advance(Duration.ofMinutes(3));

    final Ticket called = fixture.stateMachine.callNext(locationId).orElseThrow();

    assertThat(called.stateChangedAt()).isEqualTo(called.createdAt().plus(Duration.ofMinutes(3)));
  }

  @Test
  void unknownTicketIsNotFound() {
    assertThatThrownBy(() -> fixture.stateMachine.cancel(new TicketId(locationId, 99)))
        .isInstanceOf(TicketNotFoundException.class);
    assertThatThrownBy(() -> fixture.stateMachine.ticketStatus(new TicketId(locationId, 99)))
        .isInstanceOf(TicketNotFoundException.class);
  }

  @Test
  void waitingTicketsAndPositionsFollowTicketOrder() {
    for (int i = 0; i < 3; i++) {
      fixture.allocator.issueTicket(locationId);
    }
    fixture.stateMachine.cancel(new TicketId(locationId, 1));

    assertThat(fixture.stateMachine.waitingTickets(locationId))
        .extracting(Ticket::ticketNumber)
        .containsExactly(2L, 3L);

    final TicketPosition position =
        fixture.stateMachine.ticketStatus(new TicketId(locationId, 3));
    assertThat(position.position()).isEqualTo(2L);
    assertThat(position.waitingCount()).isEqualTo(2L);
    assertThat(position.estimatedWait()).isEqualTo(Duration.ofMinutes(10));

    final TicketPosition cancelled =
        fixture.stateMachine.ticketStatus(new TicketId(locationId, 1));
    assertThat(cancelled.position()).isZero();
  }

  @Test
  void transitionMetricsAreCounted() {
    fixture.allocator.issueTicket(locationId);
    fixture.stateMachine.callNext(locationId);
    fixture.stateMachine.markServed(new TicketId(locationId, 1));

    assertThat(
            fixture.meterRegistry
                .get("orderly.ticket.transition.total")
                .tag("to", "SERVED")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void scenarioThreeTicketsServeOneCancelOne() {
    final String l1 = fixture.registry.createLocation("L1").locationId();
    for (int i = 0; i < 3; i++) {
      fixture.allocator.issueTicket(l1);
    }
    assertThat(fixture.registry.getLocation(l1).nextTicketNumber()).isEqualTo(4L);

    final Ticket first = fixture.stateMachine.callNext(l1).orElseThrow();
    assertThat(first.ticketNumber()).isEqualTo(1L);
    assertThat(first.state()).isEqualTo(TicketState.CALLED);
    assertThat(fixture.registry.getLocation(l1).currentServingNumber()).isEqualTo(1L);
    assertThat(fixture.stateMachine.markServed(first.ticketId()).state())
        .isEqualTo(TicketState.SERVED);

    assertThat(fixture.stateMachine.callNext(l1)).map(Ticket::ticketNumber).hasValue(2L);
    assertThat(fixture.stateMachine.cancel(new TicketId(l1, 3)).state())
        .isEqualTo(TicketState.CANCELLED);

    final QueueView view = fixture.stateMachine.queueView(l1);
    assertThat(view.waitingCount()).isZero();
    assertThat(view.currentServingNumber()).isEqualTo(2L);
    assertThat(view.calledTicket().ticketNumber()).isEqualTo(2L);
  }

  @Test
  void callNextAfterStaleReadRetriesAndCallsTheFollowingTicket() {
    final LocalFileRecordStore inner = LocalFileRecordStore.inMemory(new ObjectMapper());
    final InterferingRecordStore store = new InterferingRecordStore(inner);
    final QueueFixture ours = new QueueFixture(store, QueueFixture.fastRetryProperties(5));
    final String desk = ours.registry.createLocation("Desk").locationId();
    ours.allocator.issueTicket(desk);
    ours.allocator.issueTicket(desk);
    // 読み取り後、commit の直前に別の窓口が #1 を呼び出す
    final QueueFixture competitor = new QueueFixture(inner, QueueFixture.fastRetryProperties(5));
    store.interfereOnce(() -> competitor.stateMachine.callNext(desk));

    final Ticket called = ours.stateMachine.callNext(desk).orElseThrow();

    assertThat(called.ticketNumber()).isEqualTo(2L);
    assertThat(ours.stateMachine.ticketStatus(new TicketId(desk, 1)).ticket().state())
        .isEqualTo(TicketState.CALLED);
    assertThat(ours.registry.getLocation(desk).currentServingNumber()).isEqualTo(2L);
    assertThat(
            ours.meterRegistry
                .get("orderly.storage.conflict.total")
                .tag("operation", "call_next")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void markServedAfterStaleReadRechecksTheTransition() {
    final LocalFileRecordStore inner = LocalFileRecordStore.inMemory(new ObjectMapper());
    final InterferingRecordStore store = new InterferingRecordStore(inner);
    final QueueFixture ours = new QueueFixture(store, QueueFixture.fastRetryProperties(5));
    final String desk = ours.registry.createLocation("Desk").locationId();
    ours.allocator.issueTicket(desk);
    ours.stateMachine.callNext(desk);
    final TicketId ticketId = new TicketId(desk, 1);
    // CALLED を読んだ直後に来訪者が取り消す
    final QueueFixture visitor = new QueueFixture(inner, QueueFixture.fastRetryProperties(5));
    store.interfereOnce(() -> visitor.stateMachine.cancel(ticketId));

    assertThatThrownBy(() -> ours.stateMachine.markServed(ticketId))
        .isInstanceOf(InvalidTicketTransitionException.class);
    assertThat(ours.stateMachine.ticketStatus(ticketId).ticket().state())
        .isEqualTo(TicketState.CANCELLED);
  }

  @Test
  void cancelAfterStaleReadRetriesOnTheCalledTicket() {
    final LocalFileRecordStore inner = LocalFileRecordStore.inMemory(new ObjectMapper());
    final InterferingRecordStore store = new InterferingRecordStore(inner);
    final QueueFixture ours = new QueueFixture(store, QueueFixture.fastRetryProperties(5));
    final String desk = ours.registry.createLocation("Desk").locationId();
    ours.allocator.issueTicket(desk);
    final TicketId ticketId = new TicketId(desk, 1);
    // WAITING を読んだ直後に窓口が呼び出す
    final QueueFixture operator = new QueueFixture(inner, QueueFixture.fastRetryProperties(5));
    store.interfereOnce(() -> operator.stateMachine.callNext(desk));

    final Ticket cancelled = ours.stateMachine.cancel(ticketId);

    assertThat(cancelled.state()).isEqualTo(TicketState.CANCELLED);
    assertThat(ours.stateMachine.ticketStatus(ticketId).ticket().state())
        .isEqualTo(TicketState.CANCELLED);
    assertThat(ours.registry.getLocation(desk).currentServingNumber()).isEqualTo(1L);
    assertThat(
            ours.meterRegistry
                .get("orderly.storage.conflict.total")
                .tag("operation", "cancel")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void concurrentCallNextNeverCallsTheSameTicketTwice() throws Exception {
    final QueueFixture shared = new QueueFixture(null, QueueFixture.fastRetryProperties(1_000));
    final String desk = shared.registry.createLocation("Desk").locationId();
    final int tickets = 100;
    for (int i = 0; i < tickets; i++) {
      shared.allocator.issueTicket(desk);
    }
    final int workers = 8;
    final ExecutorService executor = Executors.newFixedThreadPool(workers);
    final CountDownLatch start = new CountDownLatch(1);
    final List<Long> calledNumbers = Collections.synchronizedList(new ArrayList<>());
    try {
      final List<Future<?>> futures = new ArrayList<>();
      for (int w = 0; w < workers; w++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  Optional<Ticket> called = shared.stateMachine.callNext(desk);
                  while (called.isPresent()) {
                    calledNumbers.add(called.get().ticketNumber());
                    called = shared.stateMachine.callNext(desk);
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(60, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(calledNumbers).hasSize(tickets).doesNotHaveDuplicates();
    assertThat(shared.stateMachine.queueView(desk).waitingCount()).isZero();
  }

  private TicketState stateOf(TicketId ticketId) {
    return fixture.stateMachine.ticketStatus(ticketId).ticket().state();
  }
}
