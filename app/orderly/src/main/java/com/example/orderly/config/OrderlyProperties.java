/*
 * どこで: Orderly 設定
 * 何を: 公開 URL/待ち時間見積もり/worker のドメイン設定を保持する
 * なぜ: 環境差分をコード外へ出し、テストで上書きしやすくするため
 */
package com.example.orderly.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "orderly")
public record OrderlyProperties(
    @NotBlank String publicBaseUrl,
    @NotNull Duration averageServiceTime,
    @NotNull Duration workerPollInterval,
    boolean workerEnabled) {}
