/*
 * どこで: Orderly ドメインモデル
 * 何を: ロケーションの現在の待ち状況(読み取り専用の投影)を表現する
 * なぜ: 永続化せず毎回チケット状態から再計算し、二重管理を避けるため
 */
package com.example.orderly.model;

import java.time.Duration;

public record QueueView(
    String locationId,
    String locationName,
    long waitingCount,
    long currentServingNumber,
    Ticket calledTicket,
    long servedCount,
    long cancelledCount,
    long issuedCount,
    int capacity,
    Duration estimatedWait) {}
