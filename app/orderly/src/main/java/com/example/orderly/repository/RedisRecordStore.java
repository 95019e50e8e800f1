package com.example.orderly.repository;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis 上の RecordStore 実装。
 *
 * <p>1 レコード = 1 hash (payload, version)。条件付き書き込みはすべて commit_records.lua で実行し、
 * Redis のスクリプト原子性で「全件適用 or 何もしない」を保証する。同じスクリプトが論理キーの索引
 * (ZSET, score 0)も更新し、prefix 列挙はキー空間全体の SCAN ではなく索引の辞書順範囲読みで行う。
 */
public class RedisRecordStore implements RecordStore {

  static final String FIELD_PAYLOAD = "payload";
  static final String FIELD_VERSION = "version";
  private static final long CONFLICT_MARKER = -1L;
  static final String INDEX_KEY = "__index__";
  static final int PAGE_SIZE = 500;

  @SuppressWarnings("rawtypes")
  static final RedisScript<List> COMMIT_SCRIPT = loadScript("redis/commit_records.lua");

  @SuppressWarnings("rawtypes")
  static final RedisScript<List> LIST_SCRIPT = loadScript("redis/list_index.lua");

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  private final String keyPrefix;

  public RedisRecordStore(StringRedisTemplate redisTemplate, String keyPrefix) {
    this.redisTemplate = redisTemplate;
    this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
  }

  @Override
  public Optional<StoredRecord> get(String key) {
    try {
      final List<Object> values =
          redisTemplate
              .opsForHash()
              .multiGet(physicalKey(key), List.<Object>of(FIELD_PAYLOAD, FIELD_VERSION));
      if (values == null || values.size() < 2 || values.get(0) == null || values.get(1) == null) {
        return Optional.empty();
      }
      return Optional.of(
          new StoredRecord(
              key, String.valueOf(values.get(0)), Long.parseLong(String.valueOf(values.get(1)))));
    } catch (TransientDataAccessException | DataAccessResourceFailureException ex) {
      throw new StorageUnavailableException("redis get failed key=" + key, ex);
    }
  }

  /**
   * 役割: prefix で始まるキーのレコードを列挙する。
   * 動作: キー索引(ZSET)を ZRANGEBYLEX で PAGE_SIZE 件ずつ辿る。次ページは直前の最終キーより後ろから読むため、
   *     列挙中の追加/削除でページがずれない。ページ取得の失敗も StorageUnavailableException に変換する。
   * 前提: 索引は commit_records.lua だけが更新する。
   */
  @Override
  public Stream<StoredRecord> listByPrefix(String prefix) {
    final IndexPageIterator keys = new IndexPageIterator(Objects.requireNonNull(prefix, "prefix"));
    return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(
                keys, Spliterator.ORDERED | Spliterator.DISTINCT | Spliterator.NONNULL),
            false)
        .map(this::get)
        .flatMap(Optional::stream);
  }

  @Override
  public List<Long> commit(List<RecordWrite> writes) {
    RecordStore.requireDistinctKeys(writes);
    final List<String> keys = new ArrayList<>(writes.size() + 1);
    final List<String> args = new ArrayList<>(writes.size() * 5);
    for (RecordWrite write : writes) {
      keys.add(physicalKey(write.key()));
      args.add(write.operation().name());
      args.add(write.condition().kind().name());
      args.add(String.valueOf(write.condition().expectedVersion()));
      args.add(write.payload() == null ? "" : write.payload());
      args.add(write.key());
    }
    // 索引キーは最後の KEYS として渡す
    keys.add(indexKey());

    final List<?> result;
    try {
      result = redisTemplate.execute(COMMIT_SCRIPT, keys, args.toArray());
    } catch (TransientDataAccessException | DataAccessResourceFailureException ex) {
      throw new StorageUnavailableException("redis commit failed keys=" + keys, ex);
    }
    if (result == null || result.isEmpty()) {
      throw new IllegalStateException("redis commit returned no result keys=" + keys);
    }
    final long first = toLong(result.get(0));
    if (first == CONFLICT_MARKER) {
      final int index = (int) toLong(result.get(1)) - 1;
      throw new RecordConflictException(writes.get(index).key());
    }
    return result.stream().map(RedisRecordStore::toLong).toList();
  }

  String physicalKey(String key) {
    return keyPrefix + Objects.requireNonNull(key, "key");
  }

  String indexKey() {
    return keyPrefix + INDEX_KEY;
  }

  private List<String> fetchPage(String lowerBound, String prefix) {
    final List<?> page;
    try {
      page =
          redisTemplate.execute(
              LIST_SCRIPT, List.of(indexKey()), lowerBound, prefix, String.valueOf(PAGE_SIZE));
    } catch (TransientDataAccessException | DataAccessResourceFailureException ex) {
      throw new StorageUnavailableException("redis index read failed prefix=" + prefix, ex);
    }
    if (page == null) {
      return List.of();
    }
    return page.stream().map(String::valueOf).toList();
  }

  private static long toLong(Object value) {
    if (value instanceof Number number) {
      return number.longValue();
    }
    return Long.parseLong(String.valueOf(value));
  }

  @SuppressWarnings("rawtypes")
  private static RedisScript<List> loadScript(String location) {
    final DefaultRedisScript<List> script = new DefaultRedisScript<>();
    script.setLocation(new ClassPathResource(location));
    script.setResultType(List.class);
    return script;
  }

  /** 索引を 1 ページずつ遅延取得するイテレータ。 */
  private final class IndexPageIterator implements Iterator<String> {

    private final String prefix;
    private Iterator<String> page = Collections.emptyIterator();
    private String lastKey;
    private boolean exhausted;

    private IndexPageIterator(String prefix) {
      this.prefix = prefix;
    }

    @Override
    public boolean hasNext() {
      while (!page.hasNext() && !exhausted) {
        final List<String> keys =
            fetchPage(lastKey == null ? "[" + prefix : "(" + lastKey, prefix);
        exhausted = keys.size() < PAGE_SIZE;
        if (!keys.isEmpty()) {
          lastKey = keys.get(keys.size() - 1);
        }
        page = keys.iterator();
      }
      return page.hasNext();
    }

    @Override
    public String next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return page.next();
    }
  }
}
