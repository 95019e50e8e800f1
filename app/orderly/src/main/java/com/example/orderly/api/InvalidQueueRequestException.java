/*
 * どこで: Orderly API
 * 何を: ヘッダ/パスなど入力値の不正を表現する
 * なぜ: 400 応答へ変換するため
 */
package com.example.orderly.api;

public class InvalidQueueRequestException extends RuntimeException {
  public InvalidQueueRequestException(String message) {
    super(message);
  }

  public InvalidQueueRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
