/*
 * どこで: iTop 通知データアクセス
 * 何を: notifications テーブルの登録/取得/保持期限削除を担う
 * なぜ: 通知シンクの重複排除とデバッグ API を支えるため
 */
package com.example.itop_notification.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.itop_notification.model.StoredNotification;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 通知を 1 件登録する。
   *
   * @return 登録されたら true、同じ (user_id, object_type, object_key) が既にあれば false
   */
  public boolean insertIfAbsent(StoredNotification notification) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id,
          user_id,
          app,
          object_type,
          object_key,
          subject,
          params_json,
          occurred_at,
          created_at
        ) VALUES (
          :notificationId,
          :userId,
          :app,
          :objectType,
          :objectKey,
          :subject,
          :paramsJson::jsonb,
          :occurredAt,
          :createdAt
        )
        ON CONFLICT (user_id, object_type, object_key) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notification.notificationId())
            .addValue("userId", notification.userId())
            .addValue("app", notification.app())
            .addValue("objectType", notification.objectType())
            .addValue("objectKey", notification.objectKey())
            .addValue("subject", notification.subject())
            .addValue("paramsJson", notification.paramsJson())
            .addValue("occurredAt", toTimestamp(notification.occurredAt()))
            .addValue("createdAt", toTimestamp(notification.createdAt()));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public List<StoredNotification> findByUserId(String userId) {
    final String sql =
        """
        SELECT notification_id, user_id, app, object_type, object_key, subject,
               params_json::text AS params_json_text, occurred_at, created_at
        FROM notifications
        WHERE user_id = :userId
        ORDER BY occurred_at DESC, created_at DESC
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deleteOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE created_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private StoredNotification mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new StoredNotification(
        UUID.fromString(rs.getString("notification_id")),
        rs.getString("user_id"),
        rs.getString("app"),
        rs.getString("object_type"),
        rs.getString("object_key"),
        rs.getString("subject"),
        rs.getString("params_json_text"),
        toInstant(rs.getTimestamp("occurred_at")),
        toInstant(rs.getTimestamp("created_at")));
  }
}
