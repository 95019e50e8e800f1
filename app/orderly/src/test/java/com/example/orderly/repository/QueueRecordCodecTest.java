package com.example.orderly.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.orderly.model.Location;
import com.example.orderly.model.Ticket;
import com.example.orderly.model.TicketState;
import com.example.orderly.model.VisitorDetails;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class QueueRecordCodecTest {

  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");
  private final QueueRecordCodec codec = new QueueRecordCodec(new ObjectMapper());

  @Test
  void locationPayloadIsFlatSnakeCaseStrings() {
    final Location location = Location.open("loc-1", "Front desk", null, 12, "op-1", NOW);

    final String payload = codec.encodeLocation(location);

    assertThat(payload)
        .contains("\"location_id\":\"loc-1\"")
        .contains("\"next_ticket_number\":\"1\"")
        .contains("\"capacity\":\"12\"")
        .doesNotContain("description");
    assertThat(codec.decodeLocation(payload)).isEqualTo(location);
  }

  @Test
  void ticketKeepsVisitorDetails() {
    final Ticket ticket =
        Ticket.issue("loc-1", 3, new VisitorDetails("Ana", "555-0100", "wheelchair"), NOW)
            .withState(TicketState.CALLED, NOW.plusSeconds(30));

    assertThat(codec.decodeTicket(codec.encodeTicket(ticket))).isEqualTo(ticket);
  }

  @Test
  void decodingIgnoresUnknownFieldsAndDefaultsOptionalOnes() {
    final String olderPayload =
        "{\"location_id\":\"loc-1\",\"name\":\"Desk\",\"created_at\":\"2026-03-01T09:00:00Z\","
            + "\"current_serving_number\":\"0\",\"next_ticket_number\":\"5\",\"future_field\":\"x\"}";

    final Location location = codec.decodeLocation(olderPayload);

    assertThat(location.capacity()).isZero();
    assertThat(location.updatedAt()).isEqualTo(NOW);
    assertThat(location.nextTicketNumber()).isEqualTo(5L);
  }

  @Test
  void missingRequiredFieldIsReported() {
    assertThatThrownBy(() -> codec.decodeTicket("{\"location_id\":\"loc-1\"}"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("created_at");
  }

  @Test
  void idempotencyMarkerPointsAtTicketNumber() {
    assertThat(codec.decodeIdempotencyMarker(codec.encodeIdempotencyMarker(9L, NOW))).isEqualTo(9L);
  }
}
