/*
 * どこで: Orderly 設定
 * 何を: 永続化先(リモート/ローカル)と到達不能時ポリシーを保持する
 * なぜ: ストレージ戦略を起動時に一度だけ決め、エンジンから切り離すため
 */
package com.example.orderly.config;

import com.example.orderly.repository.StorageFallbackPolicy;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "orderly.storage")
public record OrderlyStorageProperties(
    @NotNull Mode mode,
    @NotNull StorageFallbackPolicy unavailablePolicy,
    String keyPrefix,
    String localFile) {

  public enum Mode {
    REMOTE,
    LOCAL
  }

  public boolean persistsLocally() {
    return localFile != null && !localFile.isBlank();
  }
}
