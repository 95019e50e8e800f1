/*
 * どこで: Orderly インフラ設定
 * 何を: orderly.storage に従って RecordStore 実装を 1 つ選び、Bean として提供する
 * なぜ: リモート/ローカル/フォールバックの選択を起動時に固定し、サービス層からは区別させないため
 */
package com.example.orderly.config;

import com.example.orderly.repository.FallbackRecordStore;
import com.example.orderly.repository.LocalFileRecordStore;
import com.example.orderly.repository.RecordStore;
import com.example.orderly.repository.RedisRecordStore;
import com.example.orderly.service.QueueMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class StorageConfig {

  private static final Logger logger = LoggerFactory.getLogger(StorageConfig.class);

  @Bean
  StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }

  @Bean
  RecordStore recordStore(
      OrderlyStorageProperties properties,
      ObjectProvider<StringRedisTemplate> redisTemplate,
      ObjectMapper objectMapper,
      QueueMetrics metrics) {
    return createRecordStore(properties, redisTemplate.getIfAvailable(), objectMapper, metrics);
  }

  static RecordStore createRecordStore(
      OrderlyStorageProperties properties,
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      QueueMetrics metrics) {
    final LocalFileRecordStore local = localStore(properties, objectMapper);
    if (properties.mode() == OrderlyStorageProperties.Mode.LOCAL) {
      logger.info("record store selected mode=local file={}", properties.localFile());
      return local;
    }
    if (redisTemplate == null) {
      throw new IllegalStateException("orderly.storage.mode=remote requires a redis connection");
    }
    // 前回の退避書き込みがスナップショットに残っていれば、照合されるまでローカルに固定したまま起動する
    final boolean unreconciled = local.isPersistent() && !local.isEmpty();
    logger.info(
        "record store selected mode=remote unavailablePolicy={} keyPrefix={} unreconciledLocal={}",
        properties.unavailablePolicy(),
        properties.keyPrefix(),
        unreconciled);
    return new FallbackRecordStore(
        new RedisRecordStore(redisTemplate, properties.keyPrefix()),
        local,
        properties.unavailablePolicy(),
        metrics,
        unreconciled);
  }

  private static LocalFileRecordStore localStore(
      OrderlyStorageProperties properties, ObjectMapper objectMapper) {
    if (!properties.persistsLocally()) {
      return LocalFileRecordStore.inMemory(objectMapper);
    }
    return new LocalFileRecordStore(objectMapper, Path.of(properties.localFile()));
  }
}
