/*
 * どこで: Orderly API レスポンス DTO
 * 何を: Status API の応答を定義する
 * なぜ: 状態ごとに返しうる情報を共通構造で表現するため
 */
package com.example.orderly.api.response;

import com.example.orderly.model.TicketPosition;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TicketStatusResponse(
    TicketResponse ticket, long position, long totalWaiting, long estimatedWaitMinutes) {

  public static TicketStatusResponse from(TicketPosition position) {
    return new TicketStatusResponse(
        TicketResponse.from(position.ticket()),
        position.position(),
        position.waitingCount(),
        position.estimatedWait().toMinutes());
  }
}
