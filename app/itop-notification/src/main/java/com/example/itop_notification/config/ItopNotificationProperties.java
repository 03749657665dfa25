/*
 * どこで: iTop 通知アプリの設定バインド
 * 何を: 通知ジョブのポーリング間隔/上限/タイムゾーン/SLA 閾値を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.example.itop_notification.config;

import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "itop.notification")
@Validated
public record ItopNotificationProperties(
    boolean agentJobEnabled,
    boolean portalJobEnabled,
    Duration agentPollInterval,
    Duration portalPollInterval,
    int maxNotificationsPerRun,
    Duration firstRunLookback,
    String defaultTimezone,
    String criticalPriority,
    List<Duration> slaWarningThresholds) {

  public ItopNotificationProperties {
    agentPollInterval = agentPollInterval == null ? Duration.ofMinutes(5) : agentPollInterval;
    portalPollInterval = portalPollInterval == null ? Duration.ofMinutes(5) : portalPollInterval;
    maxNotificationsPerRun = maxNotificationsPerRun <= 0 ? 20 : maxNotificationsPerRun;
    firstRunLookback = firstRunLookback == null ? Duration.ofDays(30) : firstRunLookback;
    defaultTimezone =
        defaultTimezone == null || defaultTimezone.isBlank() ? "UTC" : defaultTimezone;
    criticalPriority =
        criticalPriority == null || criticalPriority.isBlank() ? "1" : criticalPriority;
    // 広い閾値から順に並べ、最も狭い閾値が末尾に来るようにする
    slaWarningThresholds =
        slaWarningThresholds == null || slaWarningThresholds.isEmpty()
            ? List.of(
                Duration.ofHours(24),
                Duration.ofHours(12),
                Duration.ofHours(4),
                Duration.ofHours(1))
            : slaWarningThresholds.stream()
                .filter(threshold -> !threshold.isNegative() && !threshold.isZero())
                .distinct()
                .sorted(Comparator.reverseOrder())
                .toList();
  }

  @AssertTrue(message = "itop.notification poll intervals must be positive")
  public boolean isPollIntervalsPositive() {
    return !agentPollInterval.isZero()
        && !agentPollInterval.isNegative()
        && !portalPollInterval.isZero()
        && !portalPollInterval.isNegative();
  }
}
