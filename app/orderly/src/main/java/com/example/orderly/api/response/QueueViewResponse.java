/*
 * どこで: Orderly API レスポンス DTO
 * 何を: 待ち状況(待ち人数/呼び出し中番号/集計)の表現を定義する
 * なぜ: 表示端末と来訪者の両方が同じ集計を参照できるようにするため
 */
package com.example.orderly.api.response;

import com.example.orderly.model.QueueView;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueueViewResponse(
    String locationId,
    String locationName,
    long waitingCount,
    long currentServingNumber,
    TicketResponse calledTicket,
    long servedCount,
    long cancelledCount,
    long issuedCount,
    int capacity,
    long estimatedWaitMinutes) {

  public static QueueViewResponse from(QueueView view) {
    return new QueueViewResponse(
        view.locationId(),
        view.locationName(),
        view.waitingCount(),
        view.currentServingNumber(),
        TicketResponse.from(view.calledTicket()),
        view.servedCount(),
        view.cancelledCount(),
        view.issuedCount(),
        view.capacity(),
        view.estimatedWait().toMinutes());
  }
}
