/*
 * どこで: Orderly Repository 層
 * 何を: バックエンドストアへ到達できない状態を表現する
 * なぜ: ベンダー固有の例外を API 層から隠し、503 へ正規化するため
 */
package com.example.orderly.repository;

public class StorageUnavailableException extends RuntimeException {

  public StorageUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
