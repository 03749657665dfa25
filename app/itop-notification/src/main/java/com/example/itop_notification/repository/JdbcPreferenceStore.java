/*
 * どこで: iTop 通知データアクセス
 * 何を: app_preferences / user_preferences テーブルへの get/set/delete を担う
 * なぜ: 設定とウォーターマークを複数インスタンスで共有するため
 */
package com.example.itop_notification.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcPreferenceStore implements PreferenceStore {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final Clock clock;

  @Override
  public Optional<String> getAppValue(String key) {
    final String sql =
        """
        SELECT config_value
        FROM app_preferences
        WHERE config_key = :key
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("key", key);
    final List<String> values =
        jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getString("config_value"));
    return values.stream().findFirst();
  }

  @Override
  public void setAppValue(String key, String value) {
    final String sql =
        """
        INSERT INTO app_preferences (config_key, config_value, updated_at)
        VALUES (:key, :value, :updatedAt)
        ON CONFLICT (config_key)
        DO UPDATE SET config_value = EXCLUDED.config_value, updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("key", key)
            .addValue("value", value)
            .addValue("updatedAt", toTimestamp(Instant.now(clock)));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public void deleteAppValue(String key) {
    final String sql = "DELETE FROM app_preferences WHERE config_key = :key";
    jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("key", key));
  }

  @Override
  public Optional<String> getUserValue(String userId, String key) {
    final String sql =
        """
        SELECT config_value
        FROM user_preferences
        WHERE user_id = :userId
          AND config_key = :key
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("key", key);
    final List<String> values =
        jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getString("config_value"));
    return values.stream().findFirst();
  }

  @Override
  public void setUserValue(String userId, String key, String value) {
    final String sql =
        """
        INSERT INTO user_preferences (user_id, config_key, config_value, updated_at)
        VALUES (:userId, :key, :value, :updatedAt)
        ON CONFLICT (user_id, config_key)
        DO UPDATE SET config_value = EXCLUDED.config_value, updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("key", key)
            .addValue("value", value)
            .addValue("updatedAt", toTimestamp(Instant.now(clock)));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public void deleteUserValue(String userId, String key) {
    final String sql =
        """
        DELETE FROM user_preferences
        WHERE user_id = :userId
          AND config_key = :key
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("key", key);
    jdbcTemplate.update(sql, params);
  }

  @Override
  public List<String> findAllUserIds() {
    final String sql =
        """
        SELECT DISTINCT user_id
        FROM user_preferences
        ORDER BY user_id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), (rs, rowNum) -> rs.getString(1));
  }
}
