package com.example.orderly.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.example.orderly.service.QueueMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class FallbackRecordStoreTest {

  private final RecordStore remote = Mockito.mock(RecordStore.class);
  private final LocalFileRecordStore local = LocalFileRecordStore.inMemory(new ObjectMapper());
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final QueueMetrics metrics = new QueueMetrics(meterRegistry);

  @Test
  void failPolicySurfacesUnavailability() {
    final FallbackRecordStore store =
        new FallbackRecordStore(remote, local, StorageFallbackPolicy.FAIL, metrics);
    when(remote.commit(any())).thenThrow(unavailable());

    assertThatThrownBy(() -> store.put("k", "v", WriteCondition.none()))
        .isInstanceOf(StorageUnavailableException.class);
    assertThat(local.get("k")).isEmpty();
    assertThat(fallbackCount("commit")).isZero();
  }

  @Test
  void fallbackPolicyRoutesFailedCallsToLocalStore() {
    final FallbackRecordStore store =
        new FallbackRecordStore(remote, local, StorageFallbackPolicy.FALLBACK, metrics);
    when(remote.commit(any())).thenThrow(unavailable());
    when(remote.get("k")).thenThrow(unavailable());

    store.put("k", "v", WriteCondition.absent());

    assertThat(store.get("k")).map(StoredRecord::payload).hasValue("v");
    assertThat(fallbackCount("commit")).isEqualTo(1.0);
    // 書き込み退避後は固定されるため、get はリモートを経由しない
    assertThat(fallbackCount("get")).isZero();
    Mockito.verify(remote, Mockito.never()).get("k");
  }

  @Test
  void readFallbackDoesNotPinAndRemoteIsRetriedNextCall() {
    final FallbackRecordStore store =
        new FallbackRecordStore(remote, local, StorageFallbackPolicy.FALLBACK, metrics);
    when(remote.get("k"))
        .thenThrow(unavailable())
        .thenReturn(Optional.of(new StoredRecord("k", "remote", 2L)));

    assertThat(store.get("k")).isEmpty();
    assertThat(store.get("k")).map(StoredRecord::payload).hasValue("remote");
    assertThat(store.isPinnedToFallback()).isFalse();
    assertThat(fallbackCount("get")).isEqualTo(1.0);
  }

  @Test
  void writesDuringOutageStayVisibleAfterRemoteRecovers() {
    final RecordStore remoteRecords = LocalFileRecordStore.inMemory(new ObjectMapper());
    final ToggleRecordStore toggle = new ToggleRecordStore(remoteRecords);
    final FallbackRecordStore store =
        new FallbackRecordStore(toggle, local, StorageFallbackPolicy.FALLBACK, metrics);
    store.put("location#a", "before", WriteCondition.absent());

    toggle.setDown(true);
    final StoredRecord duringOutage =
        store.put("location#b", "during", WriteCondition.absent());
    toggle.setDown(false);

    assertThat(store.isPinnedToFallback()).isTrue();
    assertThat(store.get("location#b")).hasValue(duringOutage);
    try (Stream<StoredRecord> records = store.listByPrefix("location#")) {
      assertThat(records.map(StoredRecord::key)).contains("location#b");
    }
    store.put("location#c", "after", WriteCondition.absent());
    assertThat(remoteRecords.get("location#c")).isEmpty();
    assertThat(meterRegistry.get("orderly.storage.pinned").gauge().value()).isEqualTo(1.0);
  }

  @Test
  void startPinnedUsesLocalStoreFromTheFirstCall() {
    local.put("location#a", "local", WriteCondition.absent());
    final FallbackRecordStore store =
        new FallbackRecordStore(remote, local, StorageFallbackPolicy.FALLBACK, metrics, true);

    assertThat(store.get("location#a")).map(StoredRecord::payload).hasValue("local");
    Mockito.verifyNoInteractions(remote);
  }

  @Test
  void failPolicyIgnoresStartPinned() {
    final FallbackRecordStore store =
        new FallbackRecordStore(remote, local, StorageFallbackPolicy.FAIL, metrics, true);

    assertThat(store.isPinnedToFallback()).isFalse();
    assertThat(meterRegistry.get("orderly.storage.pinned").gauge().value()).isZero();
  }

  @Test
  void fallbackPolicyKeepsConflictsFromRemote() {
    final FallbackRecordStore store =
        new FallbackRecordStore(remote, local, StorageFallbackPolicy.FALLBACK, metrics);
    when(remote.commit(any())).thenThrow(new RecordConflictException("k"));

    assertThatThrownBy(() -> store.put("k", "v", WriteCondition.absent()))
        .isInstanceOf(RecordConflictException.class);
    assertThat(local.get("k")).isEmpty();
  }

  @Test
  void fallbackPolicyCoversFailuresWhileListing() {
    final FallbackRecordStore store =
        new FallbackRecordStore(remote, local, StorageFallbackPolicy.FALLBACK, metrics);
    local.put("ticket#a#1", "t1", WriteCondition.none());
    when(remote.listByPrefix("ticket#a#"))
        .thenReturn(
            Stream.generate(
                () -> {
                  throw unavailable();
                }));

    try (Stream<StoredRecord> records = store.listByPrefix("ticket#a#")) {
      assertThat(records.map(StoredRecord::key)).containsExactly("ticket#a#1");
    }
    assertThat(fallbackCount("list")).isEqualTo(1.0);
  }

  @Test
  void healthyRemoteIsUsedDirectly() {
    final FallbackRecordStore store =
        new FallbackRecordStore(remote, local, StorageFallbackPolicy.FALLBACK, metrics);
    when(remote.get("k")).thenReturn(Optional.of(new StoredRecord("k", "remote", 7L)));

    assertThat(store.get("k")).map(StoredRecord::version).hasValue(7L);
    assertThat(meterRegistry.find("orderly.storage.fallback.total").counter()).isNull();
  }

  private static StorageUnavailableException unavailable() {
    return new StorageUnavailableException("redis down", new IllegalStateException("refused"));
  }

  private double fallbackCount(String operation) {
    final var counter =
        meterRegistry.find("orderly.storage.fallback.total").tag("operation", operation).counter();
    return counter == null ? 0.0 : counter.count();
  }
}
