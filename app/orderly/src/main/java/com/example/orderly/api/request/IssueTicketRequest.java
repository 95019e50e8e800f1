/*
 * どこで: Orderly API リクエスト DTO
 * 何を: チケット発行 API の任意入力(来訪者情報)を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.example.orderly.api.request;

import com.example.orderly.model.VisitorDetails;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IssueTicketRequest(
    @Size(max = 100, message = "visitor_name is too long") String visitorName,
    @Size(max = 32, message = "phone is too long") String phone,
    @Size(max = 500, message = "notes is too long") String notes) {

  public VisitorDetails toVisitorDetails() {
    return new VisitorDetails(visitorName, phone, notes);
  }
}
