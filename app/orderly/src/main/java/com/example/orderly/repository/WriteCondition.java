/*
 * どこで: Orderly Repository 層
 * 何を: 条件付き書き込みの前提条件を定義する
 * なぜ: ロックを持たずに楽観的同時実行制御(CAS)を行うため
 */
package com.example.orderly.repository;

public record WriteCondition(Kind kind, long expectedVersion) {

  public enum Kind {
    NONE,
    ABSENT,
    PRESENT,
    VERSION
  }

  private static final WriteCondition NONE = new WriteCondition(Kind.NONE, 0L);
  private static final WriteCondition ABSENT = new WriteCondition(Kind.ABSENT, 0L);
  private static final WriteCondition PRESENT = new WriteCondition(Kind.PRESENT, 0L);

  public WriteCondition {
    if (kind == null) {
      throw new IllegalArgumentException("kind is required");
    }
  }

  public static WriteCondition none() {
    return NONE;
  }

  public static WriteCondition absent() {
    return ABSENT;
  }

  public static WriteCondition present() {
    return PRESENT;
  }

  public static WriteCondition version(long expectedVersion) {
    return new WriteCondition(Kind.VERSION, expectedVersion);
  }

  /**
   * 役割: 現在のバージョンに対して条件が成立するかを判定する。
   * 動作: currentVersion が null のときはレコード不在として扱う。
   * 前提: なし。
   */
  public boolean matches(Long currentVersion) {
    return switch (kind) {
      case NONE -> true;
      case ABSENT -> currentVersion == null;
      case PRESENT -> currentVersion != null;
      case VERSION -> currentVersion != null && currentVersion == expectedVersion;
    };
  }
}
