/*
 * どこで: Orderly API
 * 何を: 未完了チケットが残る location の削除要求を表現する
 * なぜ: 参照中の location を消さずに 409 応答へ変換するため
 */
package com.example.orderly.api;

public class LocationInUseException extends RuntimeException {
  public LocationInUseException(String locationId, long openTickets) {
    super("location " + locationId + " still has " + openTickets + " open tickets");
  }
}
