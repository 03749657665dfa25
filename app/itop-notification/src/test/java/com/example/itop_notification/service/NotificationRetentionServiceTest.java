/*
 * Where: iTop notification retention tests
 * What: Verifies cleanup removes only rows older than the retention window
 * Why: Recent notifications and live SLA marks must survive the cleanup
 */
package com.example.itop_notification.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.itop_notification.AbstractPostgresContainerTest;
import com.example.itop_notification.config.NotificationRetentionProperties;
import com.example.itop_notification.model.DeadlineKind;
import com.example.itop_notification.model.SlaWarningMark;
import com.example.itop_notification.model.StoredNotification;
import com.example.itop_notification.repository.NotificationRepository;
import com.example.itop_notification.repository.SlaWarningRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationRetentionServiceTest extends AbstractPostgresContainerTest {

  // Time-sensitive threshold tests are fixed to avoid boundary flakiness.
  private static final Instant FIXED_NOW = Instant.parse("2025-11-05T23:00:00Z");

  @TestConfiguration
  static class FixedClockConfig {
    @Bean(name = "testClock")
    @Primary
    Clock clock() {
      return Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
    }
  }

  @Autowired private NotificationRetentionService retentionService;

  @Autowired private NotificationRetentionProperties retentionProperties;

  @Autowired private NotificationRepository notificationRepository;

  @Autowired private SlaWarningRepository slaWarningRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM sla_warning_marks", new MapSqlParameterSource());
  }

  @Test
  void cleanupRemovesOnlyExpiredRows() {
    final int retentionDays = retentionProperties.retentionDays();
    final Instant threshold = FIXED_NOW.minus(Duration.ofDays(retentionDays));
    final Instant old = threshold.minus(Duration.ofDays(1));
    final Instant recent = threshold.plus(Duration.ofDays(1));

    notificationRepository.insertIfAbsent(notification("42|a|1", old));
    notificationRepository.insertIfAbsent(notification("42|b|2", threshold));
    notificationRepository.insertIfAbsent(notification("42|c|3", recent));
    slaWarningRepository.save(
        new SlaWarningMark("alice", "41", DeadlineKind.TTR, old, Duration.ofHours(1)));
    slaWarningRepository.save(
        new SlaWarningMark("alice", "42", DeadlineKind.TTR, FIXED_NOW, Duration.ofHours(1)));

    retentionService.cleanup();

    assertThat(count("SELECT COUNT(*) FROM notifications")).isEqualTo(2);
    assertThat(count("SELECT COUNT(*) FROM sla_warning_marks")).isEqualTo(1);
    assertThat(slaWarningRepository.find("alice", "42", DeadlineKind.TTR)).isPresent();
  }

  private static StoredNotification notification(String objectKey, Instant createdAt) {
    return new StoredNotification(
        UUID.randomUUID(),
        "alice",
        "itop",
        "ticket",
        objectKey,
        "ticket_comment",
        "{}",
        createdAt,
        createdAt);
  }

  private int count(String sql) {
    final Integer result =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return result == null ? 0 : result;
  }
}
