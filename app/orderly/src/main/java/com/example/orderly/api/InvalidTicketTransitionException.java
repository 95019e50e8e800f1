/*
 * どこで: Orderly API
 * 何を: 許可されていないチケット状態遷移を表現する
 * なぜ: 状態を変えずに 409 応答へ変換するため
 */
package com.example.orderly.api;

import com.example.orderly.model.TicketState;

public class InvalidTicketTransitionException extends RuntimeException {

  public InvalidTicketTransitionException(String ticketId, TicketState from, TicketState to) {
    super("ticket " + ticketId + " cannot transition from " + from + " to " + to);
  }
}
