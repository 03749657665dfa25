/*
 * どこで: iTop 通知 API モデル
 * 何を: デバッグ用通知一覧の要素
 * なぜ: 冪等キーとパラメータを確認できるようにするため
 */
package com.example.itop_notification.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSummary(
    UUID notificationId,
    String subject,
    String objectType,
    String objectKey,
    Instant occurredAt,
    Instant createdAt,
    JsonNode params) {}
