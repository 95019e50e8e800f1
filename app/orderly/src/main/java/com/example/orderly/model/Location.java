/*
 * どこで: Orderly ドメインモデル
 * 何を: 受付窓口(ロケーション)と採番カウンタの状態を表現する
 * なぜ: 採番と呼び出し番号を同じレコードのバージョンで保護するため
 */
package com.example.orderly.model;

import java.time.Instant;

public record Location(
    String locationId,
    String name,
    String description,
    int capacity,
    String createdBy,
    Instant createdAt,
    Instant updatedAt,
    long currentServingNumber,
    long nextTicketNumber) {

  public static final long FIRST_TICKET_NUMBER = 1L;

  public static Location open(
      String locationId,
      String name,
      String description,
      int capacity,
      String createdBy,
      Instant now) {
    return new Location(
        locationId, name, description, capacity, createdBy, now, now, 0L, FIRST_TICKET_NUMBER);
  }

  public long issuedCount() {
    return nextTicketNumber - FIRST_TICKET_NUMBER;
  }

  public Location withTicketIssued(Instant now) {
    return new Location(
        locationId,
        name,
        description,
        capacity,
        createdBy,
        createdAt,
        now,
        currentServingNumber,
        nextTicketNumber + 1);
  }

  public Location withServing(long ticketNumber, Instant now) {
    return new Location(
        locationId,
        name,
        description,
        capacity,
        createdBy,
        createdAt,
        now,
        ticketNumber,
        nextTicketNumber);
  }
}
