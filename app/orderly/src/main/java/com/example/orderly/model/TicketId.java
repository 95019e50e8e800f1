/*
 * どこで: Orderly ドメインモデル
 * 何を: location_id + ticket_number の複合キーを表現する
 * なぜ: チケット番号はロケーション内でのみ一意なため
 */
package com.example.orderly.model;

public record TicketId(String locationId, long ticketNumber) {

  private static final char SEPARATOR = '-';

  public TicketId {
    if (locationId == null || locationId.isBlank()) {
      throw new IllegalArgumentException("locationId is required");
    }
    if (ticketNumber < 1) {
      throw new IllegalArgumentException("ticketNumber must be positive");
    }
  }

  /** 外部公開用の表記 "{locationId}-{ticketNumber}" を返す。 */
  public String value() {
    return locationId + SEPARATOR + ticketNumber;
  }

  /**
   * 役割: value() 表記を TicketId へ戻す。
   * 動作: 最後の '-' で分割する。location_id 自体が '-' を含む UUID でも番号側は数字のみのため一意に分割できる。
   * 前提: 不正な表記は IllegalArgumentException とする。
   */
  public static TicketId parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("ticket id is required");
    }
    final int separator = value.lastIndexOf(SEPARATOR);
    if (separator <= 0 || separator == value.length() - 1) {
      throw new IllegalArgumentException("malformed ticket id: " + value);
    }
    try {
      return new TicketId(
          value.substring(0, separator), Long.parseLong(value.substring(separator + 1)));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("malformed ticket id: " + value, ex);
    }
  }
}
