/*
 * どこで: iTop 通知サービス層
 * 何を: 通知を notifications テーブルへ保存するシンク
 * なぜ: (user_id, object_type, object_key) の一意制約で再実行時の重複配信を防ぐため
 */
package com.example.itop_notification.service;

import com.example.itop_notification.model.Notification;
import com.example.itop_notification.model.StoredNotification;
import com.example.itop_notification.repository.NotificationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JdbcNotificationSink implements NotificationSink {

  private static final Logger logger = LoggerFactory.getLogger(JdbcNotificationSink.class);

  private final NotificationRepository notificationRepository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Override
  public void notify(Notification notification) {
    final StoredNotification stored =
        new StoredNotification(
            UUID.randomUUID(),
            notification.userId(),
            notification.app(),
            notification.objectType(),
            notification.objectKey(),
            notification.subject(),
            toJson(notification),
            notification.dateTime(),
            Instant.now(clock));
    if (!notificationRepository.insertIfAbsent(stored)) {
      logger.debug(
          "duplicate notification dropped userId={} objectKey={}",
          notification.userId(),
          notification.objectKey());
    }
  }

  private String toJson(Notification notification) {
    try {
      return objectMapper.writeValueAsString(notification.params());
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("notification params serialization failure", ex);
    }
  }
}
