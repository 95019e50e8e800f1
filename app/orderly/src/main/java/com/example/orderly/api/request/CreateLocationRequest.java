/*
 * どこで: Orderly API リクエスト DTO
 * 何を: Location 作成 API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.example.orderly.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateLocationRequest(
    @NotBlank(message = "name is required") @Size(max = 200, message = "name is too long")
        String name,
    @Size(max = 1000, message = "description is too long") String description,
    @PositiveOrZero(message = "capacity must not be negative") Integer capacity) {}
