/*
 * どこで: SLA 警告マークリポジトリの統合テスト
 * 何を: upsert による上書きと期限切れマークの削除を Postgres で検証する
 * なぜ: 期限が変わったチケットの警告レベルが正しくやり直されることを保証するため
 */
package com.example.itop_notification.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.itop_notification.AbstractPostgresContainerTest;
import com.example.itop_notification.model.DeadlineKind;
import com.example.itop_notification.model.SlaWarningMark;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class SlaWarningRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant DEADLINE = Instant.parse("2025-11-06T10:00:00Z");

  @Autowired private SlaWarningRepository slaWarningRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM sla_warning_marks", new MapSqlParameterSource());
  }

  @Test
  void saveOverwritesLevelAndDeadlineForSameTicketAndKind() {
    slaWarningRepository.save(
        new SlaWarningMark("alice", "42", DeadlineKind.TTR, DEADLINE, Duration.ofHours(24)));
    slaWarningRepository.save(
        new SlaWarningMark(
            "alice",
            "42",
            DeadlineKind.TTR,
            DEADLINE.plus(Duration.ofHours(2)),
            Duration.ofHours(4)));

    assertThat(slaWarningRepository.find("alice", "42", DeadlineKind.TTR))
        .hasValueSatisfying(
            mark -> {
              assertThat(mark.deadlineAt()).isEqualTo(DEADLINE.plus(Duration.ofHours(2)));
              assertThat(mark.level()).isEqualTo(Duration.ofHours(4));
            });
    assertThat(slaWarningRepository.find("alice", "42", DeadlineKind.TTO)).isEmpty();
  }

  @Test
  void deleteDeadlinesBeforeRemovesOnlyPassedDeadlines() {
    slaWarningRepository.save(
        new SlaWarningMark(
            "alice",
            "41",
            DeadlineKind.TTO,
            DEADLINE.minus(Duration.ofDays(1)),
            Duration.ofHours(1)));
    slaWarningRepository.save(
        new SlaWarningMark("alice", "42", DeadlineKind.TTO, DEADLINE, Duration.ofHours(1)));

    final int deleted = slaWarningRepository.deleteDeadlinesBefore(DEADLINE);

    assertThat(deleted).isEqualTo(1);
    assertThat(slaWarningRepository.find("alice", "41", DeadlineKind.TTO)).isEmpty();
    assertThat(slaWarningRepository.find("alice", "42", DeadlineKind.TTO)).isPresent();
  }

  @Test
  void deleteByUserIdLeavesOtherUsers() {
    slaWarningRepository.save(
        new SlaWarningMark("alice", "42", DeadlineKind.TTR, DEADLINE, Duration.ofHours(4)));
    slaWarningRepository.save(
        new SlaWarningMark("bob", "42", DeadlineKind.TTR, DEADLINE, Duration.ofHours(4)));

    assertThat(slaWarningRepository.deleteByUserId("alice")).isEqualTo(1);
    assertThat(slaWarningRepository.find("bob", "42", DeadlineKind.TTR)).isPresent();
  }
}
