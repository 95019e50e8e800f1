/*
 * どこで: Orderly Repository 層
 * 何を: 条件付き書き込みの不成立(競合)を表現する
 * なぜ: 上書きせずに失敗させ、呼び出し側で再読込+再試行させるため
 */
package com.example.orderly.repository;

public class RecordConflictException extends RuntimeException {

  private final String key;

  public RecordConflictException(String key) {
    super("conditional write rejected: " + key);
    this.key = key;
  }

  public String key() {
    return key;
  }
}
