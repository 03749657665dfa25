/*
 * どこで: iTop 通知サービス層
 * 何を: iTop のローカル時刻文字列と Instant を相互変換する
 * なぜ: iTop はタイムゾーン無しのサーバーローカル時刻で日時を返すため
 */
package com.example.itop_notification.service;

import com.example.itop_notification.config.ItopNotificationProperties;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ItopTimestamps {

  private static final Logger logger = LoggerFactory.getLogger(ItopTimestamps.class);

  static final DateTimeFormatter ITOP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
  private static final List<DateTimeFormatter> LOOSE_LOCAL_FORMATS =
      List.of(
          DateTimeFormatter.ISO_LOCAL_DATE_TIME,
          DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
          DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"));

  private final ZoneId zone;
  private final Clock clock;

  public ItopTimestamps(ItopNotificationProperties properties, Clock clock) {
    this.zone = resolveZone(properties.defaultTimezone());
    this.clock = clock;
  }

  public ZoneId zone() {
    return zone;
  }

  /** Parses an iTop timestamp; falls back to looser formats, then to the current instant. */
  public Instant parseOrNow(String raw) {
    return tryParse(raw).orElseGet(() -> Instant.now(clock));
  }

  public Optional<Instant> tryParse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    final String value = raw.trim();
    try {
      return Optional.of(LocalDateTime.parse(value, ITOP_FORMAT).atZone(zone).toInstant());
    } catch (DateTimeParseException ex) {
      // 形式が異なる場合は緩い解析へ進む
    }
    final Optional<Instant> loose = parseLoosely(value);
    if (loose.isEmpty()) {
      logger.debug("itop timestamp could not be parsed value={}", value);
    }
    return loose;
  }

  public String format(Instant instant) {
    return ITOP_FORMAT.format(instant.atZone(zone));
  }

  private Optional<Instant> parseLoosely(String value) {
    try {
      return Optional.of(OffsetDateTime.parse(value).toInstant());
    } catch (DateTimeParseException ex) {
      // オフセット無しの形式を順に試す
    }
    for (DateTimeFormatter formatter : LOOSE_LOCAL_FORMATS) {
      try {
        return Optional.of(LocalDateTime.parse(value, formatter).atZone(zone).toInstant());
      } catch (DateTimeParseException ex) {
        // 次の形式を試す
      }
    }
    try {
      return Optional.of(LocalDate.parse(value).atStartOfDay(zone).toInstant());
    } catch (DateTimeParseException ex) {
      // 日付のみでもない
    }
    if (value.length() <= 12 && value.chars().allMatch(Character::isDigit)) {
      return Optional.of(Instant.ofEpochSecond(Long.parseLong(value)));
    }
    return Optional.empty();
  }

  private static ZoneId resolveZone(String configured) {
    try {
      return ZoneId.of(configured);
    } catch (DateTimeException ex) {
      logger.info("invalid timezone configured; fallback to UTC timezone={}", configured);
      return ZoneOffset.UTC;
    }
  }
}
