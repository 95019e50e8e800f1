/*
 * どこで: Orderly Repository 層
 * 何を: リモートストア到達不能時の振る舞い(失敗 or ローカルへ退避)を適用する
 * なぜ: 障害時ポリシーを起動時設定で切り替え、エンジン側には分岐を持ち込まないため
 */
package com.example.orderly.repository;

import com.example.orderly.service.QueueMetrics;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 退避ポリシー付きの RecordStore。
 *
 * <p>FALLBACK 時、読み取りの退避は一時的で次の呼び出しはリモートから再試行する。書き込みが一度でも
 * ローカルへ適用されたら、以後はローカルに固定(pinned)してリモートを使わない。ローカルにしか無い
 * 変更をリモート復旧後に見失わないためで、固定の解除はローカル側を照合してから再起動で行う。
 */
public class FallbackRecordStore implements RecordStore {

  private static final Logger logger = LoggerFactory.getLogger(FallbackRecordStore.class);

  private final RecordStore primary;
  private final RecordStore fallback;
  private final StorageFallbackPolicy policy;
  private final QueueMetrics metrics;
  private final AtomicBoolean pinned;

  public FallbackRecordStore(
      RecordStore primary,
      RecordStore fallback,
      StorageFallbackPolicy policy,
      QueueMetrics metrics) {
    this(primary, fallback, policy, metrics, false);
  }

  /**
   * 役割: 退避ポリシー付きストアを組み立てる。
   * 動作: startPinned=true なら最初からローカルに固定する(前回の退避書き込みが未照合のまま残っている場合)。
   * 前提: startPinned は FALLBACK ポリシーでのみ意味を持つ。
   */
  public FallbackRecordStore(
      RecordStore primary,
      RecordStore fallback,
      StorageFallbackPolicy policy,
      QueueMetrics metrics,
      boolean startPinned) {
    this.primary = primary;
    this.fallback = fallback;
    this.policy = policy;
    this.metrics = metrics;
    this.pinned = new AtomicBoolean(startPinned && policy == StorageFallbackPolicy.FALLBACK);
    metrics.bindStoragePinned(this.pinned);
    if (this.pinned.get()) {
      logger.error(
          "local fallback store holds unreconciled writes, remote storage stays unused until"
              + " the local records are reconciled");
    }
  }

  public boolean isPinnedToFallback() {
    return pinned.get();
  }

  @Override
  public Optional<StoredRecord> get(String key) {
    if (pinned.get()) {
      return fallback.get(key);
    }
    return route("get", () -> primary.get(key), () -> fallback.get(key));
  }

  @Override
  public Stream<StoredRecord> listByPrefix(String prefix) {
    if (pinned.get()) {
      return fallback.listByPrefix(prefix);
    }
    if (policy == StorageFallbackPolicy.FAIL) {
      return primary.listByPrefix(prefix);
    }
    // 列挙途中の障害も退避対象にするため、リモート側は先に読み切る
    final List<StoredRecord> records =
        route(
            "list",
            () -> {
              try (Stream<StoredRecord> stream = primary.listByPrefix(prefix)) {
                return stream.toList();
              }
            },
            () -> {
              try (Stream<StoredRecord> stream = fallback.listByPrefix(prefix)) {
                return stream.toList();
              }
            });
    return records.stream();
  }

  @Override
  public List<Long> commit(List<RecordWrite> writes) {
    if (pinned.get()) {
      return fallback.commit(writes);
    }
    return route("commit", () -> primary.commit(writes), () -> commitToFallback(writes));
  }

  private List<Long> commitToFallback(List<RecordWrite> writes) {
    final List<Long> versions = fallback.commit(writes);
    if (pinned.compareAndSet(false, true)) {
      logger.error(
          "write applied to local fallback store, pinning all storage calls to it until the"
              + " local records are reconciled with remote storage firstKey={}",
          writes.get(0).key());
    }
    return versions;
  }

  private <T> T route(String operation, Supplier<T> onPrimary, Supplier<T> onFallback) {
    try {
      return onPrimary.get();
    } catch (StorageUnavailableException ex) {
      metrics.recordDependencyError("storage_" + operation);
      if (policy == StorageFallbackPolicy.FAIL) {
        throw ex;
      }
      logger.warn("remote storage unavailable, using local fallback operation={}", operation, ex);
      metrics.recordStorageFallback(operation);
      return onFallback.get();
    }
  }
}
