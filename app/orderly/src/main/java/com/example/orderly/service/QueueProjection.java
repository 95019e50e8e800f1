/*
 * どこで: Orderly Service 層
 * 何を: チケット状態の集合から待ち状況/待ち順位を計算する純粋関数群
 * なぜ: 表示用の集計値を永続化せず、常に現在のチケット状態から導出するため
 */
package com.example.orderly.service;

import com.example.orderly.model.Location;
import com.example.orderly.model.QueueView;
import com.example.orderly.model.Ticket;
import com.example.orderly.model.TicketPosition;
import com.example.orderly.model.TicketState;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;

public final class QueueProjection {

  private QueueProjection() {}

  /** 番号昇順の WAITING チケット。 */
  public static List<Ticket> waiting(List<Ticket> tickets) {
    return tickets.stream()
        .filter(ticket -> ticket.state() == TicketState.WAITING)
        .sorted(Comparator.comparingLong(Ticket::ticketNumber))
        .toList();
  }

  public static QueueView view(
      Location location, List<Ticket> tickets, Duration averageServiceTime) {
    final long waitingCount = count(tickets, TicketState.WAITING);
    // 直近に呼び出され、まだ CALLED のまま残っている最大番号のチケット
    final Ticket calledTicket =
        tickets.stream()
            .filter(ticket -> ticket.state() == TicketState.CALLED)
            .max(Comparator.comparingLong(Ticket::ticketNumber))
            .orElse(null);
    return new QueueView(
        location.locationId(),
        location.name(),
        waitingCount,
        location.currentServingNumber(),
        calledTicket,
        count(tickets, TicketState.SERVED),
        count(tickets, TicketState.CANCELLED),
        location.issuedCount(),
        location.capacity(),
        estimateWait(waitingCount, averageServiceTime));
  }

  /**
   * 役割: チケットの待ち順位(1 始まり)を返す。
   * 動作: WAITING 以外は position=0、見込み待ち時間 0 とする。見込みは position × 平均対応時間。
   */
  public static TicketPosition position(
      Ticket ticket, List<Ticket> tickets, Duration averageServiceTime) {
    final List<Ticket> waiting = waiting(tickets);
    if (ticket.state() != TicketState.WAITING) {
      return new TicketPosition(ticket, 0L, waiting.size(), Duration.ZERO);
    }
    final long ahead =
        waiting.stream()
            .filter(other -> other.ticketNumber() < ticket.ticketNumber())
            .count();
    final long position = ahead + 1;
    return new TicketPosition(
        ticket, position, waiting.size(), estimateWait(position, averageServiceTime));
  }

  static Duration estimateWait(long people, Duration averageServiceTime) {
    if (people <= 0 || averageServiceTime == null) {
      return Duration.ZERO;
    }
    return averageServiceTime.multipliedBy(people);
  }

  private static long count(List<Ticket> tickets, TicketState state) {
    return tickets.stream().filter(ticket -> ticket.state() == state).count();
  }
}
