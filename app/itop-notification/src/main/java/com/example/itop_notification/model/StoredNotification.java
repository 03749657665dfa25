/*
 * どこで: iTop 通知ドメインモデル
 * 何を: notifications テーブルのスナップショット
 * なぜ: シンクの永続化とデバッグ API で共通化するため
 */
package com.example.itop_notification.model;

import java.time.Instant;
import java.util.UUID;

public record StoredNotification(
    UUID notificationId,
    String userId,
    String app,
    String objectType,
    String objectKey,
    String subject,
    String paramsJson,
    Instant occurredAt,
    Instant createdAt) {}
