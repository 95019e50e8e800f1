/*
 * どこで: Common ユーティリティ
 * 何を: リクエスト相関 ID の解決/採番を行う
 * なぜ: 受信ヘッダの ID を優先しつつ、欠落時も必ずログに ID を残すため
 */
package com.example.common;

import java.util.UUID;

public final class RequestIds {
  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  /** 役割: 受信値が空でなければそのまま返し、空なら新規 ID を採番する。 */
  public static String resolve(String candidate) {
    if (candidate != null && !candidate.isBlank()) {
      return candidate.trim();
    }
    return newRequestId();
  }
}
