/*
 * どこで: iTop 通知データアクセス
 * 何を: sla_warning_marks に利用者×チケット×期限種別ごとの最終通知レベルを保持する
 * なぜ: ポーリングごとではなく閾値を新たに跨いだときだけ SLA 警告を出すため
 */
package com.example.itop_notification.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.itop_notification.model.DeadlineKind;
import com.example.itop_notification.model.SlaWarningMark;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SlaWarningRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final Clock clock;

  public Optional<SlaWarningMark> find(String userId, String ticketId, DeadlineKind kind) {
    final String sql =
        """
        SELECT user_id, ticket_id, deadline_kind, deadline_at, level_seconds
        FROM sla_warning_marks
        WHERE user_id = :userId
          AND ticket_id = :ticketId
          AND deadline_kind = :kind
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("ticketId", ticketId)
            .addValue("kind", kind.name());
    final List<SlaWarningMark> marks = jdbcTemplate.query(sql, params, this::mapRow);
    return marks.stream().findFirst();
  }

  public void save(SlaWarningMark mark) {
    // 期限が変わった場合も同じ行を上書きし、レベルの記録をやり直す
    final String sql =
        """
        INSERT INTO sla_warning_marks (
          user_id,
          ticket_id,
          deadline_kind,
          deadline_at,
          level_seconds,
          signaled_at
        ) VALUES (
          :userId,
          :ticketId,
          :kind,
          :deadlineAt,
          :levelSeconds,
          :signaledAt
        )
        ON CONFLICT (user_id, ticket_id, deadline_kind)
        DO UPDATE SET deadline_at = EXCLUDED.deadline_at,
                      level_seconds = EXCLUDED.level_seconds,
                      signaled_at = EXCLUDED.signaled_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", mark.userId())
            .addValue("ticketId", mark.ticketId())
            .addValue("kind", mark.kind().name())
            .addValue("deadlineAt", toTimestamp(mark.deadlineAt()))
            .addValue("levelSeconds", mark.level().toSeconds())
            .addValue("signaledAt", toTimestamp(Instant.now(clock)));
    jdbcTemplate.update(sql, params);
  }

  public int deleteByUserId(String userId) {
    final String sql = "DELETE FROM sla_warning_marks WHERE user_id = :userId";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("userId", userId));
  }

  public int deleteDeadlinesBefore(Instant threshold) {
    final String sql = "DELETE FROM sla_warning_marks WHERE deadline_at < :threshold";
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)));
  }

  private SlaWarningMark mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SlaWarningMark(
        rs.getString("user_id"),
        rs.getString("ticket_id"),
        DeadlineKind.valueOf(rs.getString("deadline_kind")),
        rs.getTimestamp("deadline_at").toInstant(),
        Duration.ofSeconds(rs.getLong("level_seconds")));
  }
}
