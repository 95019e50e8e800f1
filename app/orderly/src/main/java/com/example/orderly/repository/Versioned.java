package com.example.orderly.repository;

/** 読み取った値と、その時点のレコードバージョン。条件付き書き込みの期待値として使う。 */
public record Versioned<T>(T value, long version) {}
