/*
 * どこで: Orderly API
 * 何を: location 未検出を表現する
 * なぜ: 404 応答へ変換するため
 */
package com.example.orderly.api;

public class LocationNotFoundException extends RuntimeException {
  public LocationNotFoundException(String locationId) {
    super("location not found: " + locationId);
  }
}
