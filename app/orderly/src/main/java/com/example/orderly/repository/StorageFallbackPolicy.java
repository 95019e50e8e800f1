package com.example.orderly.repository;

/** リモートストア到達不能時の扱い。 */
public enum StorageFallbackPolicy {
  FAIL,
  FALLBACK
}
