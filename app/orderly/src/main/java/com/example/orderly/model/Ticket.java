/*
 * どこで: Orderly ドメインモデル
 * 何を: 1 人の来訪者の順番待ち権利を表現する
 * なぜ: Repository と Service 間で受け渡す構造を固定するため
 */
package com.example.orderly.model;

import java.time.Instant;

public record Ticket(
    String locationId,
    long ticketNumber,
    TicketState state,
    VisitorDetails visitor,
    Instant createdAt,
    Instant stateChangedAt) {

  public static Ticket issue(
      String locationId, long ticketNumber, VisitorDetails visitor, Instant now) {
    return new Ticket(locationId, ticketNumber, TicketState.WAITING, visitor, now, now);
  }

  public TicketId ticketId() {
    return new TicketId(locationId, ticketNumber);
  }

  public Ticket withState(TicketState next, Instant now) {
    return new Ticket(locationId, ticketNumber, next, visitor, createdAt, now);
  }
}
