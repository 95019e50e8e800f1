/*
 * どこで: Orderly API
 * 何を: チケット発行/呼び出し/完了/取消と待ち状況照会のエンドポイントを公開する
 * なぜ: 来訪者と運用者の双方からの順番待ち操作を受け付ける入口を提供するため
 */
package com.example.orderly.api;

import com.example.orderly.api.request.IssueTicketRequest;
import com.example.orderly.api.response.QueueViewResponse;
import com.example.orderly.api.response.TicketResponse;
import com.example.orderly.api.response.TicketStatusResponse;
import com.example.orderly.api.response.WaitingTicketsResponse;
import com.example.orderly.model.Ticket;
import com.example.orderly.model.TicketId;
import com.example.orderly.model.VisitorDetails;
import com.example.orderly.service.QueueStateMachine;
import com.example.orderly.service.TicketAllocator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class QueueController {

  private static final String HEADER_IDEMPOTENCY_KEY = "Idempotency-Key";

  private final TicketAllocator ticketAllocator;
  private final QueueStateMachine stateMachine;
  private final RequestDeadlines requestDeadlines;

  @PostMapping("/v1/locations/{location_id}/tickets")
  public ResponseEntity<TicketResponse> issueTicket(
      @PathVariable("location_id") String locationId,
      @RequestHeader(value = HEADER_IDEMPOTENCY_KEY, required = false) String idempotencyKey,
      @RequestHeader(value = RequestDeadlines.HEADER_TIMEOUT_MS, required = false)
          String timeoutMillis,
      @Valid @RequestBody(required = false) IssueTicketRequest request) {
    final VisitorDetails visitor =
        request == null ? VisitorDetails.anonymous() : request.toVisitorDetails();
    final Ticket ticket =
        ticketAllocator.issueTicket(
            locationId, visitor, idempotencyKey, requestDeadlines.resolve(timeoutMillis));
    return ResponseEntity.status(HttpStatus.CREATED).body(TicketResponse.from(ticket));
  }

  @GetMapping("/v1/locations/{location_id}/tickets/{ticket_number}")
  public ResponseEntity<TicketStatusResponse> getTicketStatus(
      @PathVariable("location_id") String locationId,
      @PathVariable("ticket_number") long ticketNumber) {
    return ResponseEntity.ok(
        TicketStatusResponse.from(
            stateMachine.ticketStatus(new TicketId(locationId, ticketNumber))));
  }

  @PostMapping("/v1/locations/{location_id}/tickets/{ticket_number}/serve")
  public ResponseEntity<TicketResponse> markServed(
      @PathVariable("location_id") String locationId,
      @PathVariable("ticket_number") long ticketNumber,
      @RequestHeader(value = RequestDeadlines.HEADER_TIMEOUT_MS, required = false)
          String timeoutMillis) {
    return ResponseEntity.ok(
        TicketResponse.from(
            stateMachine.markServed(
                new TicketId(locationId, ticketNumber), requestDeadlines.resolve(timeoutMillis))));
  }

  @PostMapping("/v1/locations/{location_id}/tickets/{ticket_number}/cancel")
  public ResponseEntity<TicketResponse> cancel(
      @PathVariable("location_id") String locationId,
      @PathVariable("ticket_number") long ticketNumber,
      @RequestHeader(value = RequestDeadlines.HEADER_TIMEOUT_MS, required = false)
          String timeoutMillis) {
    return ResponseEntity.ok(
        TicketResponse.from(
            stateMachine.cancel(
                new TicketId(locationId, ticketNumber), requestDeadlines.resolve(timeoutMillis))));
  }

  @PostMapping("/v1/locations/{location_id}/call-next")
  public ResponseEntity<TicketResponse> callNext(
      @PathVariable("location_id") String locationId,
      @RequestHeader(value = RequestDeadlines.HEADER_TIMEOUT_MS, required = false)
          String timeoutMillis) {
    return stateMachine
        .callNext(locationId, requestDeadlines.resolve(timeoutMillis))
        .map(ticket -> ResponseEntity.ok(TicketResponse.from(ticket)))
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  @GetMapping("/v1/locations/{location_id}/queue")
  public ResponseEntity<QueueViewResponse> getQueue(
      @PathVariable("location_id") String locationId) {
    return ResponseEntity.ok(QueueViewResponse.from(stateMachine.queueView(locationId)));
  }

  @GetMapping("/v1/locations/{location_id}/queue/waiting")
  public ResponseEntity<WaitingTicketsResponse> getWaitingTickets(
      @PathVariable("location_id") String locationId) {
    return ResponseEntity.ok(
        new WaitingTicketsResponse(
            locationId,
            stateMachine.waitingTickets(locationId).stream().map(TicketResponse::from).toList()));
  }

  @GetMapping("/v1/tickets/{ticket_id}")
  public ResponseEntity<TicketStatusResponse> getTicketStatusById(
      @PathVariable("ticket_id") String ticketId) {
    return ResponseEntity.ok(
        TicketStatusResponse.from(stateMachine.ticketStatus(TicketId.parse(ticketId))));
  }
}
