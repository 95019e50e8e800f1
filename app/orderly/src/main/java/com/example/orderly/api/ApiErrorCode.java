/*
 * どこで: Orderly API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.orderly.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  VALIDATION_ERROR,
  LOCATION_NOT_FOUND,
  TICKET_NOT_FOUND,
  CONTENTION_RETRYABLE,
  INVALID_TRANSITION,
  LOCATION_IN_USE,
  TICKET_NUMBERS_EXHAUSTED,
  STORAGE_UNAVAILABLE,
  INTERNAL_ERROR
}
