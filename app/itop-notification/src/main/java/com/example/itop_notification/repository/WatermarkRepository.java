/*
 * どこで: iTop 通知データアクセス
 * 何を: 利用者×ジョブ種別の最終処理時刻(ウォーターマーク)を読み書きする
 * なぜ: 次回の差分検出の下限をジョブ間で一貫した形式で保持するため
 */
package com.example.itop_notification.repository;

import com.example.itop_notification.model.JobKind;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class WatermarkRepository {

  private static final Logger logger = LoggerFactory.getLogger(WatermarkRepository.class);

  private final PreferenceStore preferenceStore;

  public Optional<Instant> find(String userId, JobKind job) {
    final Optional<String> raw = preferenceStore.getUserValue(userId, key(job));
    if (raw.isEmpty() || raw.get().isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Instant.ofEpochSecond(Long.parseLong(raw.get().trim())));
    } catch (NumberFormatException ex) {
      // 旧形式(ローカル日時文字列)などは初回扱いにする
      logger.warn("unreadable watermark treated as absent userId={} job={}", userId, job.value());
      return Optional.empty();
    }
  }

  public void save(String userId, JobKind job, Instant watermark) {
    preferenceStore.setUserValue(userId, key(job), Long.toString(watermark.getEpochSecond()));
  }

  public void delete(String userId, JobKind job) {
    preferenceStore.deleteUserValue(userId, key(job));
  }

  static String key(JobKind job) {
    return "notification_last_" + job.value() + "_check";
  }
}
