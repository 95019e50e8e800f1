/*
 * どこで: Orderly Repository 層
 * 何を: RecordStore 上の論理キー表記を一元化する
 * なぜ: Redis とローカルフォールバックで同じキー配置を共有するため
 */
package com.example.orderly.repository;

public final class RecordKeys {

  static final String LOCATION_PREFIX = "location#";
  static final String TICKET_PREFIX = "ticket#";
  static final String IDEMPOTENCY_PREFIX = "idempotency#";

  private RecordKeys() {}

  public static String location(String locationId) {
    return LOCATION_PREFIX + locationId;
  }

  public static String locationPrefix() {
    return LOCATION_PREFIX;
  }

  public static String ticket(String locationId, long ticketNumber) {
    return ticketPrefix(locationId) + ticketNumber;
  }

  /** 末尾の '#' まで含めるため、ある location_id が別の location_id の接頭辞でも混ざらない。 */
  public static String ticketPrefix(String locationId) {
    return TICKET_PREFIX + locationId + "#";
  }

  public static String idempotency(String locationId, String idempotencyKey) {
    return IDEMPOTENCY_PREFIX + locationId + "#" + idempotencyKey;
  }
}
