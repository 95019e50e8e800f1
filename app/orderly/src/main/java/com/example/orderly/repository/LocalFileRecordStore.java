package com.example.orderly.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ローカルフォールバック用の RecordStore 実装。
 *
 * <p>snapshotFile が null の場合はメモリのみで動作する。指定時は commit ごとに JSON スナップショットを
 * 一時ファイルへ書き出してから原子的に置き換え、書き出しに成功した場合のみメモリへ反映する。
 */
public class LocalFileRecordStore implements RecordStore {

  private static final Logger logger = LoggerFactory.getLogger(LocalFileRecordStore.class);
  private static final TypeReference<List<StoredRecord>> SNAPSHOT_TYPE = new TypeReference<>() {};

  private final ConcurrentSkipListMap<String, StoredRecord> records = new ConcurrentSkipListMap<>();
  private final ReentrantLock commitLock = new ReentrantLock();
  private final Path snapshotFile;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public LocalFileRecordStore(ObjectMapper objectMapper, Path snapshotFile) {
    this.objectMapper = objectMapper;
    this.snapshotFile = snapshotFile;
    load();
  }

  public static LocalFileRecordStore inMemory(ObjectMapper objectMapper) {
    return new LocalFileRecordStore(objectMapper, null);
  }

  /** スナップショット読込後も含め、レコードを 1 件も保持していなければ true。 */
  public boolean isEmpty() {
    return records.isEmpty();
  }

  public boolean isPersistent() {
    return snapshotFile != null;
  }

  @Override
  public Optional<StoredRecord> get(String key) {
    return Optional.ofNullable(records.get(key));
  }

  @Override
  public Stream<StoredRecord> listByPrefix(String prefix) {
    return records.tailMap(prefix, true).values().stream()
        .takeWhile(record -> record.key().startsWith(prefix));
  }

  @Override
  public List<Long> commit(List<RecordWrite> writes) {
    RecordStore.requireDistinctKeys(writes);
    commitLock.lock();
    try {
      for (RecordWrite write : writes) {
        final StoredRecord current = records.get(write.key());
        if (!write.condition().matches(current == null ? null : current.version())) {
          throw new RecordConflictException(write.key());
        }
      }

      final List<Long> versions = new ArrayList<>(writes.size());
      final Map<String, StoredRecord> staged = new TreeMap<>();
      for (RecordWrite write : writes) {
        if (write.operation() == RecordWrite.Operation.DELETE) {
          staged.put(write.key(), null);
          versions.add(0L);
          continue;
        }
        final StoredRecord current = records.get(write.key());
        final long nextVersion = current == null ? 1L : current.version() + 1;
        staged.put(write.key(), new StoredRecord(write.key(), write.payload(), nextVersion));
        versions.add(nextVersion);
      }

      if (snapshotFile != null) {
        final TreeMap<String, StoredRecord> next = new TreeMap<>(records);
        staged.forEach(
            (key, record) -> {
              if (record == null) {
                next.remove(key);
              } else {
                next.put(key, record);
              }
            });
        persist(next.values());
      }
      staged.forEach(
          (key, record) -> {
            if (record == null) {
              records.remove(key);
            } else {
              records.put(key, record);
            }
          });
      return versions;
    } finally {
      commitLock.unlock();
    }
  }

  private void load() {
    if (snapshotFile == null || !Files.exists(snapshotFile)) {
      return;
    }
    try {
      final List<StoredRecord> loaded = objectMapper.readValue(snapshotFile.toFile(), SNAPSHOT_TYPE);
      for (StoredRecord record : loaded) {
        records.put(record.key(), record);
      }
      logger.info("loaded local snapshot records={} file={}", records.size(), snapshotFile);
    } catch (IOException ex) {
      throw new StorageUnavailableException("failed to load local snapshot " + snapshotFile, ex);
    }
  }

  private void persist(Collection<StoredRecord> snapshot) {
    try {
      final Path parent = snapshotFile.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      final Path temp = snapshotFile.resolveSibling(snapshotFile.getFileName() + ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
      Files.move(
          temp, snapshotFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException ex) {
      throw new StorageUnavailableException("failed to write local snapshot " + snapshotFile, ex);
    }
  }
}
