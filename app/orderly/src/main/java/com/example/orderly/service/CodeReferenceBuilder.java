/*
 * どこで: Orderly Service 層
 * 何を: 来訪者が読み取るコード(QR 等)に埋め込む参加用/状況確認用の URL を組み立てる
 * なぜ: 公開ベース URL の設定と location_id だけから決まる値を 1 か所で生成するため
 */
package com.example.orderly.service;

import com.example.orderly.config.OrderlyProperties;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

@Component
@RequiredArgsConstructor
public class CodeReferenceBuilder {

  static final String JOIN_PATH = "/queue/";
  static final String STATUS_PATH = "/status_check/";

  private final OrderlyProperties properties;

  /** 参加用 URL: {public-base-url}/queue/{locationId} */
  public String buildReference(String locationId) {
    return build(JOIN_PATH, locationId);
  }

  /** 状況確認用 URL: {public-base-url}/status_check/{locationId} */
  public String buildStatusReference(String locationId) {
    return build(STATUS_PATH, locationId);
  }

  private String build(String path, String locationId) {
    if (locationId == null || locationId.isBlank()) {
      throw new IllegalArgumentException("locationId is required");
    }
    return baseUrl() + path + UriUtils.encodePathSegment(locationId, StandardCharsets.UTF_8);
  }

  private String baseUrl() {
    final String base = properties.publicBaseUrl();
    return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
  }
}
