/*
 * どこで: Orderly API
 * 何を: 採番カウンタが上限に達した状態を表現する
 * なぜ: 番号の巻き戻し/再利用をせずに明示的に失敗させるため
 */
package com.example.orderly.api;

public class TicketNumberExhaustedException extends RuntimeException {
  public TicketNumberExhaustedException(String locationId) {
    super("ticket numbers exhausted for location: " + locationId);
  }
}
