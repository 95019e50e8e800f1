/*
 * どこで: Orderly Repository 層
 * 何を: キー/値レコードに対する get/put/delete/prefix 列挙と原子的な条件付き一括書き込みを抽象化する
 * なぜ: Redis とローカルフォールバックをエンジンから区別なく使えるようにするため
 */
package com.example.orderly.repository;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

public interface RecordStore {

  /**
   * 役割: key のレコードを取得する。
   * 動作: 存在すれば payload と現在バージョンを返し、存在しなければ empty を返す。
   * 前提: key は空でないこと。
   */
  Optional<StoredRecord> get(String key);

  /**
   * 役割: prefix で始まるキーのレコードを列挙する。
   * 動作: 遅延評価の有限ストリームを返す。順序は保証しない。再度呼べば最初から列挙し直せる。
   * 前提: 呼び出し側はストリームを close すること。
   */
  Stream<StoredRecord> listByPrefix(String prefix);

  /**
   * 役割: 複数レコードの書き込みを原子的に適用する。
   * 動作: すべての条件を先に検査し、1 件でも不成立なら何も書かずに RecordConflictException を送出する。
   *     成立時は writes と同じ順序で新バージョンを返す(DELETE は 0)。
   * 前提: writes は空でなく、同じ key を重複して含まないこと。
   */
  List<Long> commit(List<RecordWrite> writes);

  default StoredRecord put(String key, String payload, WriteCondition condition) {
    final List<Long> versions = commit(List.of(RecordWrite.put(key, payload, condition)));
    return new StoredRecord(key, payload, versions.get(0));
  }

  /** 存在しない key に対しては false を返す。 */
  default boolean delete(String key) {
    try {
      commit(List.of(RecordWrite.delete(key, WriteCondition.present())));
      return true;
    } catch (RecordConflictException ex) {
      return false;
    }
  }

  static void requireDistinctKeys(List<RecordWrite> writes) {
    if (writes == null || writes.isEmpty()) {
      throw new IllegalArgumentException("writes must not be empty");
    }
    final long distinct = writes.stream().map(RecordWrite::key).distinct().count();
    if (distinct != writes.size()) {
      throw new IllegalArgumentException("writes must not contain duplicate keys");
    }
  }
}
