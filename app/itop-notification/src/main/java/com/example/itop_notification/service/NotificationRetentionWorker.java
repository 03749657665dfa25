/*
 * Where: iTop notification cleanup worker
 * What: Triggers retention cleanup on a schedule
 * Why: Automate deletion without manual intervention
 */
package com.example.itop_notification.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "itop.retention.enabled", havingValue = "true")
public class NotificationRetentionWorker {

  private final NotificationRetentionService retentionService;

  @Scheduled(fixedDelayString = "${itop.retention.cleanup-interval:PT1H}")
  public void run() {
    retentionService.cleanup();
  }
}
