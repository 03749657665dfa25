/*
 * どこで: iTop 通知キャッシュ
 * 何を: 分散キャッシュへ保存する {cached_at, ttl, data} ラッパー
 * なぜ: バックエンドの TTL 精度に依存せずアプリ側で期限を検証するため
 */
package com.example.itop_notification.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CacheEntry(Long cachedAt, Long ttl, JsonNode data) {

  public boolean isWellFormed() {
    return cachedAt != null && ttl != null && ttl >= 0 && data != null && !data.isNull();
  }

  public long ageSeconds(long nowEpochSecond) {
    return nowEpochSecond - cachedAt;
  }

  public boolean isExpired(long nowEpochSecond) {
    return ageSeconds(nowEpochSecond) > ttl;
  }
}
