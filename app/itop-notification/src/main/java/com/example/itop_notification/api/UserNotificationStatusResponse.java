/*
 * どこで: iTop 通知 API モデル
 * 何を: 利用者の通知設定とジョブ別の実行可否
 * なぜ: 「なぜ通知が来ないか」を運用者が確認できるようにするため
 */
package com.example.itop_notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserNotificationStatusResponse(
    String userId,
    boolean notificationEnabled,
    String personId,
    String itopUserId,
    Integer checkIntervalMinutes,
    int defaultIntervalMinutes,
    Map<String, JobStatus> jobs) {

  public UserNotificationStatusResponse {
    jobs = jobs == null ? Map.of() : Map.copyOf(jobs);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record JobStatus(
      Instant lastCheck, String outcome, Instant nextEligibleAt, List<String> enabledTypes) {
    public JobStatus {
      enabledTypes = enabledTypes == null ? List.of() : List.copyOf(enabledTypes);
    }
  }
}
