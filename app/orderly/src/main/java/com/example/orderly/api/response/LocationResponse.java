/*
 * どこで: Orderly API レスポンス DTO
 * 何を: Location の表現(参加用/状況確認用 URL 付き)を定義する
 * なぜ: 作成直後にそのままコードを印刷できるようにするため
 */
package com.example.orderly.api.response;

import com.example.orderly.model.Location;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LocationResponse(
    String locationId,
    String name,
    String description,
    int capacity,
    String createdBy,
    String createdAt,
    String updatedAt,
    long currentServingNumber,
    long nextTicketNumber,
    long issuedCount,
    String joinUrl,
    String statusUrl) {

  public static LocationResponse from(Location location, CodeReferenceResponse references) {
    return new LocationResponse(
        location.locationId(),
        location.name(),
        location.description(),
        location.capacity(),
        location.createdBy(),
        location.createdAt().toString(),
        location.updatedAt().toString(),
        location.currentServingNumber(),
        location.nextTicketNumber(),
        location.issuedCount(),
        references.joinUrl(),
        references.statusUrl());
  }
}
