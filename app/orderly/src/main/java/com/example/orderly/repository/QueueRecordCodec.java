/*
 * どこで: Orderly Repository 層
 * 何を: Location/Ticket/冪等性マーカーとストア payload(フラットな JSON 文字列マップ)を相互変換する
 * なぜ: フィールド追加のみで互換を保てる保存形式を 1 か所に固定するため
 */
package com.example.orderly.repository;

import com.example.orderly.model.Location;
import com.example.orderly.model.Ticket;
import com.example.orderly.model.TicketState;
import com.example.orderly.model.VisitorDetails;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class QueueRecordCodec {

  private static final TypeReference<Map<String, String>> FIELDS_TYPE = new TypeReference<>() {};

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public String encodeLocation(Location location) {
    final Map<String, String> fields = new LinkedHashMap<>();
    fields.put("location_id", location.locationId());
    fields.put("name", location.name());
    putIfPresent(fields, "description", location.description());
    fields.put("capacity", String.valueOf(location.capacity()));
    putIfPresent(fields, "created_by", location.createdBy());
    fields.put("created_at", location.createdAt().toString());
    fields.put("updated_at", location.updatedAt().toString());
    fields.put("current_serving_number", String.valueOf(location.currentServingNumber()));
    fields.put("next_ticket_number", String.valueOf(location.nextTicketNumber()));
    return write(fields);
  }

  public Location decodeLocation(String payload) {
    final Map<String, String> fields = read(payload);
    final Instant createdAt = Instant.parse(required(fields, "created_at"));
    final String updatedAt = fields.get("updated_at");
    return new Location(
        required(fields, "location_id"),
        required(fields, "name"),
        fields.get("description"),
        Integer.parseInt(fields.getOrDefault("capacity", "0")),
        fields.get("created_by"),
        createdAt,
        updatedAt == null ? createdAt : Instant.parse(updatedAt),
        Long.parseLong(required(fields, "current_serving_number")),
        Long.parseLong(required(fields, "next_ticket_number")));
  }

  public String encodeTicket(Ticket ticket) {
    final Map<String, String> fields = new LinkedHashMap<>();
    fields.put("location_id", ticket.locationId());
    fields.put("ticket_number", String.valueOf(ticket.ticketNumber()));
    fields.put("state", ticket.state().name());
    final VisitorDetails visitor =
        ticket.visitor() == null ? VisitorDetails.anonymous() : ticket.visitor();
    putIfPresent(fields, "visitor_name", visitor.name());
    putIfPresent(fields, "phone", visitor.phone());
    putIfPresent(fields, "notes", visitor.notes());
    fields.put("created_at", ticket.createdAt().toString());
    fields.put("state_changed_at", ticket.stateChangedAt().toString());
    return write(fields);
  }

  public Ticket decodeTicket(String payload) {
    final Map<String, String> fields = read(payload);
    final Instant createdAt = Instant.parse(required(fields, "created_at"));
    final String stateChangedAt = fields.get("state_changed_at");
    return new Ticket(
        required(fields, "location_id"),
        Long.parseLong(required(fields, "ticket_number")),
        TicketState.fromValue(required(fields, "state")),
        new VisitorDetails(fields.get("visitor_name"), fields.get("phone"), fields.get("notes")),
        createdAt,
        stateChangedAt == null ? createdAt : Instant.parse(stateChangedAt));
  }

  public String encodeIdempotencyMarker(long ticketNumber, Instant createdAt) {
    final Map<String, String> fields = new LinkedHashMap<>();
    fields.put("ticket_number", String.valueOf(ticketNumber));
    fields.put("created_at", createdAt.toString());
    return write(fields);
  }

  public long decodeIdempotencyMarker(String payload) {
    return Long.parseLong(required(read(payload), "ticket_number"));
  }

  private String write(Map<String, String> fields) {
    try {
      return objectMapper.writeValueAsString(fields);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to encode record", ex);
    }
  }

  private Map<String, String> read(String payload) {
    try {
      return objectMapper.readValue(payload, FIELDS_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to decode record", ex);
    }
  }

  private static String required(Map<String, String> fields, String name) {
    final String value = fields.get(name);
    if (value == null) {
      throw new IllegalStateException("record field missing: " + name);
    }
    return value;
  }

  private static void putIfPresent(Map<String, String> fields, String name, String value) {
    if (value != null) {
      fields.put(name, value);
    }
  }
}
