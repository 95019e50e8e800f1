/*
 * どこで: Orderly API レスポンス DTO
 * 何を: コードに埋め込む URL の組を定義する
 * なぜ: 表示側が参加用/状況確認用の 2 つのコードを描画できるようにするため
 */
package com.example.orderly.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CodeReferenceResponse(String locationId, String joinUrl, String statusUrl) {}
