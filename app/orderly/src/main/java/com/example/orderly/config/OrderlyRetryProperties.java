/*
 * どこで: Orderly 設定
 * 何を: 楽観的並行制御の再試行回数/バックオフ/操作期限を保持する
 * なぜ: 競合時の待ち方を運用パラメータとして外部化するため
 */
package com.example.orderly.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "orderly.retry")
public record OrderlyRetryProperties(
    @Min(1) int maxAttempts,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    @DecimalMin("0.0") double backoffJitterMin,
    @DecimalMin("0.0") double backoffJitterMax,
    @NotNull Duration operationTimeout) {}
