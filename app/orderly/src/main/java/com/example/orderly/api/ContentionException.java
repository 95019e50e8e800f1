/*
 * どこで: Orderly API
 * 何を: 再試行予算または期限を使い切った競合を表現する
 * なぜ: 部分的な副作用なしに「再試行可能」としてクライアントへ返すため
 */
package com.example.orderly.api;

public class ContentionException extends RuntimeException {

  private final String operation;
  private final int attempts;

  public ContentionException(String operation, int attempts) {
    super("contention retry exhausted operation=" + operation + " attempts=" + attempts);
    this.operation = operation;
    this.attempts = attempts;
  }

  public ContentionException(String operation, int attempts, Throwable cause) {
    super("contention retry interrupted operation=" + operation + " attempts=" + attempts, cause);
    this.operation = operation;
    this.attempts = attempts;
  }

  public String operation() {
    return operation;
  }

  public int attempts() {
    return attempts;
  }
}
