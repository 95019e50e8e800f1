/*
 * どこで: Orderly Repository 層
 * 何を: ストアに保存された 1 レコード(不透明な payload + バージョン)を表現する
 * なぜ: 条件付き書き込みの比較対象となるバージョンを payload と一緒に扱うため
 */
package com.example.orderly.repository;

public record StoredRecord(String key, String payload, long version) {}
