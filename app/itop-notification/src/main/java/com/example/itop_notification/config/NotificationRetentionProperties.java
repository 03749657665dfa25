/*
 * Where: iTop notification application configuration binding
 * What: Holds retention cleanup settings
 * Why: Keep retention policy and schedule tunable per environment
 */
package com.example.itop_notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "itop.retention")
public record NotificationRetentionProperties(
    boolean enabled, int retentionDays, Duration cleanupInterval) {

  public NotificationRetentionProperties {
    retentionDays = retentionDays <= 0 ? 30 : retentionDays;
    cleanupInterval = cleanupInterval == null ? Duration.ofHours(1) : cleanupInterval;
  }
}
