/*
 * Where: iTop notification service layer
 * What: Applies retention policy for stored notifications and SLA warning marks
 * Why: Prevent unbounded growth of tables the jobs only ever append to
 */
package com.example.itop_notification.service;

import com.example.itop_notification.config.NotificationRetentionProperties;
import com.example.itop_notification.repository.NotificationRepository;
import com.example.itop_notification.repository.SlaWarningRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionService.class);

  private final NotificationRepository notificationRepository;
  private final SlaWarningRepository slaWarningRepository;
  private final NotificationRetentionProperties properties;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(Duration.ofDays(properties.retentionDays()));
    final int deletedNotifications = notificationRepository.deleteOlderThan(threshold);
    // 期限を過ぎたマークは二度と参照されない
    final int deletedMarks = slaWarningRepository.deleteDeadlinesBefore(threshold);
    logger.info(
        "notification retention cleanup deleted notifications={} slaWarningMarks={} threshold={}",
        deletedNotifications,
        deletedMarks,
        threshold);
  }
}
