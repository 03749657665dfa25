/*
 * どこで: iTop 通知サービス層
 * 何を: 検出結果を通知シンクへ渡す(上限/無変更/自己操作/日時正規化/冪等キーの順に判定)
 * なぜ: 全ジョブで同じ抑止規則と同じキー生成を保証するため
 */
package com.example.itop_notification.service;

import com.example.itop_notification.model.ChangeRecord;
import com.example.itop_notification.model.Notification;
import com.example.itop_notification.model.NotificationTarget;
import com.example.itop_notification.model.NotificationType;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

@Service
@RequiredArgsConstructor
public class NotificationDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

  static final String APP_ID = "itop";
  static final String OBJECT_TYPE = "ticket";
  static final String PARAM_TICKET_ID = "ticket_id";
  static final String PARAM_TIMESTAMP = "timestamp";

  private final NotificationSink sink;
  private final ItopTimestamps timestamps;
  private final NotificationJobMetrics metrics;
  private final Clock clock;

  /**
   * 変更記録を伴わない通知(SLA 警告/チーム割当)を送る。
   *
   * @return シンクへ渡せたら true
   */
  public boolean dispatch(
      NotificationTarget target,
      NotificationType type,
      Map<String, String> params,
      NotificationBudget budget) {
    if (budget.isExhausted()) {
      logger.debug(
          "notification budget exhausted userId={} type={}", target.userId(), type.subject());
      return false;
    }
    return send(target, type, params, budget);
  }

  /** 変更記録から通知を送る。無変更の記録と本人による変更は通知しない。 */
  public boolean dispatchChange(
      NotificationTarget target,
      NotificationType type,
      ChangeRecord change,
      Map<String, String> params,
      NotificationBudget budget) {
    if (budget.isExhausted()) {
      logger.debug(
          "notification budget exhausted userId={} type={}", target.userId(), type.subject());
      return false;
    }
    if (change.isNoOp()) {
      return false;
    }
    if (target.isActor(change.actorUserId())) {
      logger.debug(
          "self-initiated change suppressed userId={} ticketId={} type={}",
          target.userId(),
          change.objectKey(),
          type.subject());
      return false;
    }
    return send(target, type, params, budget);
  }

  /** ticket_id|subject|md5(timestamp) の先頭 8 文字。timestamp が無い場合は現在時刻(epoch 秒)。 */
  public String idempotencyKey(String ticketId, NotificationType type, String rawTimestamp) {
    final String suffix =
        rawTimestamp == null || rawTimestamp.isEmpty()
            ? Long.toString(Instant.now(clock).getEpochSecond())
            : DigestUtils.md5DigestAsHex(rawTimestamp.getBytes(StandardCharsets.UTF_8))
                .substring(0, 8);
    return ticketId + "|" + type.subject() + "|" + suffix;
  }

  public String formatTimestamp(Instant instant) {
    return timestamps.format(instant);
  }

  private boolean send(
      NotificationTarget target,
      NotificationType type,
      Map<String, String> params,
      NotificationBudget budget) {
    final String rawTimestamp = params.get(PARAM_TIMESTAMP);
    final Instant occurredAt =
        rawTimestamp == null ? Instant.now(clock) : timestamps.parseOrNow(rawTimestamp);
    final String objectKey = idempotencyKey(params.get(PARAM_TICKET_ID), type, rawTimestamp);
    final Notification notification =
        sink.createNotification()
            .app(APP_ID)
            .user(target.userId())
            .dateTime(occurredAt)
            .object(OBJECT_TYPE, objectKey)
            .subject(type.subject(), params)
            .build();
    try {
      sink.notify(notification);
    } catch (RuntimeException ex) {
      // 1 件の失敗で利用者の処理全体を止めない。上限も消費しない
      logger.error(
          "notification sink failed userId={} type={} objectKey={}",
          target.userId(),
          type.subject(),
          objectKey,
          ex);
      return false;
    }
    budget.consume(1);
    metrics.recordSent(type.audience(), type);
    return true;
  }
}
