/*
 * どこで: iTop 通知サービス層
 * 何を: Redis 上の TTL 付きキャッシュ (get/set/invalidate/clear)
 * なぜ: iTop API への重複読み取りを抑えつつ、期限切れの値を返さないため
 */
package com.example.itop_notification.service;

import com.example.itop_notification.config.ItopCacheProperties;
import com.example.itop_notification.model.CacheEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
public class TtlCache {

  private static final Logger logger = LoggerFactory.getLogger(TtlCache.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  private final ObjectMapper objectMapper;
  private final ItopCacheProperties properties;
  private final NotificationJobMetrics metrics;
  private final Clock clock;

  public TtlCache(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      ItopCacheProperties properties,
      NotificationJobMetrics metrics,
      Clock clock) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  public <T> Optional<T> get(String key, Class<T> type) {
    return get(key, objectMapper.constructType(type));
  }

  public <T> Optional<T> get(String key, TypeReference<T> type) {
    return get(key, objectMapper.getTypeFactory().constructType(type));
  }

  private <T> Optional<T> get(String key, JavaType type) {
    final String redisKey = redisKey(key);
    final String raw = redisTemplate.opsForValue().get(redisKey);
    if (raw == null) {
      metrics.recordCacheResult("miss");
      return Optional.empty();
    }
    final Optional<CacheEntry> entry = readEntry(raw);
    if (entry.isEmpty()) {
      // 形式が変わったエントリは削除して次回の set で作り直す
      logger.warn("cache entry has invalid format; removing key={}", redisKey);
      redisTemplate.delete(redisKey);
      metrics.recordCacheResult("malformed");
      return Optional.empty();
    }
    final long now = Instant.now(clock).getEpochSecond();
    final CacheEntry wrapper = entry.get();
    if (wrapper.isExpired(now)) {
      logger.debug(
          "cache entry expired key={} age={} ttl={}",
          redisKey,
          wrapper.ageSeconds(now),
          wrapper.ttl());
      redisTemplate.delete(redisKey);
      metrics.recordCacheResult("expired");
      return Optional.empty();
    }
    try {
      final T value = objectMapper.convertValue(wrapper.data(), type);
      metrics.recordCacheResult("hit");
      return Optional.ofNullable(value);
    } catch (IllegalArgumentException ex) {
      logger.warn("cache entry payload does not match type; removing key={}", redisKey, ex);
      redisTemplate.delete(redisKey);
      metrics.recordCacheResult("malformed");
      return Optional.empty();
    }
  }

  public void set(String key, Object value, Duration ttl) {
    if (value == null) {
      invalidate(key);
      return;
    }
    final long ttlSeconds = Math.max(1, ttl.toSeconds());
    final CacheEntry entry =
        new CacheEntry(
            Instant.now(clock).getEpochSecond(), ttlSeconds, objectMapper.valueToTree(value));
    final String json;
    try {
      json = objectMapper.writeValueAsString(entry);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("cache entry serialization failure", ex);
    }
    // ネイティブ TTL は補助的な退避として同じ値を設定する
    redisTemplate.opsForValue().set(redisKey(key), json, Duration.ofSeconds(ttlSeconds));
  }

  public void invalidate(String key) {
    redisTemplate.delete(redisKey(key));
    logger.debug("cache entry invalidated key={}", redisKey(key));
  }

  /** Removes every entry under this cache namespace. */
  public long clear() {
    final Set<String> keys = redisTemplate.keys(properties.namespace() + ":*");
    if (keys == null || keys.isEmpty()) {
      logger.warn("cache cleared namespace={} removed=0", properties.namespace());
      return 0;
    }
    final Long removed = redisTemplate.delete(keys);
    final long count = removed == null ? 0 : removed;
    logger.warn("cache cleared namespace={} removed={}", properties.namespace(), count);
    return count;
  }

  @VisibleForTesting
  String redisKey(String key) {
    return properties.namespace() + ":" + key;
  }

  private Optional<CacheEntry> readEntry(String raw) {
    try {
      final CacheEntry entry = objectMapper.readValue(raw, CacheEntry.class);
      return entry != null && entry.isWellFormed() ? Optional.of(entry) : Optional.empty();
    } catch (JsonProcessingException ex) {
      return Optional.empty();
    }
  }
}
