/*
 * どこで: Orderly API レスポンス DTO
 * 何を: チケット 1 件の表現を定義する
 * なぜ: 発行/遷移/照会の各 API で同じ形を返すため
 */
package com.example.orderly.api.response;

import com.example.orderly.model.Ticket;
import com.example.orderly.model.VisitorDetails;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TicketResponse(
    String ticketId,
    String locationId,
    long ticketNumber,
    String state,
    String visitorName,
    String phone,
    String notes,
    String createdAt,
    String stateChangedAt) {

  public static TicketResponse from(Ticket ticket) {
    if (ticket == null) {
      return null;
    }
    final VisitorDetails visitor =
        ticket.visitor() == null ? VisitorDetails.anonymous() : ticket.visitor();
    return new TicketResponse(
        ticket.ticketId().value(),
        ticket.locationId(),
        ticket.ticketNumber(),
        ticket.state().name(),
        visitor.name(),
        visitor.phone(),
        visitor.notes(),
        ticket.createdAt().toString(),
        ticket.stateChangedAt().toString());
  }
}
