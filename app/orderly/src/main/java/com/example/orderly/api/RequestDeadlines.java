package com.example.orderly.api;

import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * X-Request-Timeout-Ms ヘッダから操作期限を求める。ヘッダがなければ null(サービス側の既定期限)。
 *
 * <p>期限は再試行ループと同じ Clock で計算する。
 */
@Component
@RequiredArgsConstructor
class RequestDeadlines {

  static final String HEADER_TIMEOUT_MS = "X-Request-Timeout-Ms";

  private final Clock clock;

  Instant resolve(String timeoutMillis) {
    if (timeoutMillis == null || timeoutMillis.isBlank()) {
      return null;
    }
    final long millis;
    try {
      millis = Long.parseLong(timeoutMillis.trim());
    } catch (NumberFormatException ex) {
      throw new InvalidQueueRequestException(HEADER_TIMEOUT_MS + " must be a number", ex);
    }
    if (millis <= 0) {
      throw new InvalidQueueRequestException(HEADER_TIMEOUT_MS + " must be positive");
    }
    return clock.instant().plusMillis(millis);
  }
}
