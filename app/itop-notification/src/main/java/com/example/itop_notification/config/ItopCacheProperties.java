/*
 * どこで: iTop 通知アプリの設定バインド
 * 何を: TTL キャッシュの名前空間と用途別 TTL を保持する
 * なぜ: iTop API への重複読み取りを環境ごとに調整するため
 */
package com.example.itop_notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "itop.cache")
public record ItopCacheProperties(
    String namespace,
    Duration ticketIdsTtl,
    Duration teamsTtl,
    Duration personNamesTtl,
    Duration profileTtl) {

  static final Duration MIN_TTL = Duration.ofSeconds(10);
  static final Duration MAX_TTL = Duration.ofHours(1);

  public ItopCacheProperties {
    namespace = namespace == null || namespace.isBlank() ? "itop_notification" : namespace;
    ticketIdsTtl = clamp(ticketIdsTtl, Duration.ofSeconds(60));
    teamsTtl = clamp(teamsTtl, Duration.ofSeconds(300));
    personNamesTtl = clamp(personNamesTtl, Duration.ofSeconds(300));
    profileTtl = clamp(profileTtl, Duration.ofSeconds(300));
  }

  private static Duration clamp(Duration value, Duration fallback) {
    if (value == null) {
      return fallback;
    }
    if (value.compareTo(MIN_TTL) < 0) {
      return MIN_TTL;
    }
    if (value.compareTo(MAX_TTL) > 0) {
      return MAX_TTL;
    }
    return value;
  }
}
