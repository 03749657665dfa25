/*
 * どこで: iTop 通知リポジトリの統合テスト
 * 何を: 冪等登録・利用者別取得順・保持期限削除を Postgres で検証する
 * なぜ: 同じオブジェクトキーの再送が二重登録されないことを DB 制約で保証するため
 */
package com.example.itop_notification.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.itop_notification.AbstractPostgresContainerTest;
import com.example.itop_notification.model.StoredNotification;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2025-11-05T23:00:00Z");
  private static final Duration GAP = Duration.ofHours(1);

  @Autowired private NotificationRepository notificationRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
  }

  @Test
  void insertIfAbsentIgnoresDuplicateObjectKey() {
    final String key = "42|ticket_reassigned|425b875f";

    final boolean first = notificationRepository.insertIfAbsent(record("alice", key, BASE_TIME));
    final boolean second = notificationRepository.insertIfAbsent(record("alice", key, BASE_TIME));
    final boolean otherUser = notificationRepository.insertIfAbsent(record("bob", key, BASE_TIME));

    assertThat(first).isTrue();
    assertThat(second).isFalse();
    assertThat(otherUser).isTrue();
    assertThat(notificationRepository.findByUserId("alice")).hasSize(1);
  }

  @Test
  void findByUserIdReturnsNewestFirstWithParams() {
    notificationRepository.insertIfAbsent(record("alice", "42|a|1", BASE_TIME.minus(GAP)));
    notificationRepository.insertIfAbsent(record("alice", "42|b|2", BASE_TIME));
    notificationRepository.insertIfAbsent(record("bob", "42|c|3", BASE_TIME));

    final List<StoredNotification> found = notificationRepository.findByUserId("alice");

    assertThat(found).extracting(StoredNotification::objectKey).containsExactly("42|b|2", "42|a|1");
    assertThat(found.get(0).occurredAt()).isEqualTo(BASE_TIME);
    assertThat(found.get(0).paramsJson()).contains("\"ticket_id\"").contains("\"42\"");
  }

  @Test
  void deleteOlderThanKeepsRecordsAtThreshold() {
    notificationRepository.insertIfAbsent(record("alice", "42|a|1", BASE_TIME.minus(GAP)));
    notificationRepository.insertIfAbsent(record("alice", "42|b|2", BASE_TIME));
    notificationRepository.insertIfAbsent(record("alice", "42|c|3", BASE_TIME.plus(GAP)));

    final int deleted = notificationRepository.deleteOlderThan(BASE_TIME);

    assertThat(deleted).isEqualTo(1);
    assertThat(notificationRepository.findByUserId("alice"))
        .extracting(StoredNotification::objectKey)
        .containsExactly("42|c|3", "42|b|2");
  }

  private static StoredNotification record(String userId, String objectKey, Instant at) {
    return new StoredNotification(
        UUID.randomUUID(),
        userId,
        "itop",
        "ticket",
        objectKey,
        "ticket_reassigned",
        "{\"ticket_id\":\"42\"}",
        at,
        at);
  }
}
