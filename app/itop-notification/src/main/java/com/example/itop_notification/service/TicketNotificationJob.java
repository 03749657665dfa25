/*
 * どこで: iTop 通知ジョブ
 * 何を: 全利用者を列挙し、判定/差分検出/通知/ウォーターマーク更新を利用者単位で実行する共通骨格
 * なぜ: ポータル/エージェント両ジョブで失敗の隔離・ログ・集計を同じにするため
 */
package com.example.itop_notification.service;

import com.example.itop_notification.model.ChangeRecord;
import com.example.itop_notification.model.JobKind;
import com.example.itop_notification.model.JobRunSummary;
import com.example.itop_notification.model.NotificationTarget;
import com.example.itop_notification.model.NotificationType;
import com.example.itop_notification.model.SchedulingDecision;
import com.example.itop_notification.repository.NotificationSettingsRepository;
import com.example.itop_notification.repository.WatermarkRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

public abstract class TicketNotificationJob {

  private static final Logger logger = LoggerFactory.getLogger(TicketNotificationJob.class);

  static final String MDC_JOB = "job";
  static final String MDC_USER_ID = "user_id";

  protected final JobServices services;
  private final JobKind kind;

  protected TicketNotificationJob(JobServices services, JobKind kind) {
    this.services = services;
    this.kind = kind;
  }

  public JobKind kind() {
    return kind;
  }

  /**
   * 1 回分の実行。利用者単位の失敗は集計に含めてログへ残し、残りの利用者は続行する。
   *
   * <p>アプリケーショントークンが拒否された場合は残りの利用者を処理せずに終了する。
   */
  public JobRunSummary run() {
    final Clock clock = services.clock();
    final Instant runStart = Instant.now(clock);
    MDC.put(MDC_JOB, kind.value());
    try {
      if (!services.itopClient().isConfigured()) {
        logger.warn(
            "{} notification check skipped; itop application token is not configured",
            kind.value());
        return new JobRunSummary(kind, 0, 0, 0, 0, Duration.ZERO);
      }
      final Duration adminDefault =
          Duration.ofMinutes(services.settingsRepository().findDefaultIntervalMinutes());
      final List<String> userIds = services.settingsRepository().findAllUserIds();
      int processed = 0;
      int skipped = 0;
      int failed = 0;
      int sent = 0;
      for (String userId : userIds) {
        MDC.put(MDC_USER_ID, userId);
        try {
          final SchedulingDecision decision =
              services.userScheduler().evaluate(userId, kind, adminDefault);
          if (!decision.eligible()) {
            logger.debug("user skipped userId={} outcome={}", userId, decision.outcome());
            skipped++;
            services.metrics().recordUserResult(kind, "skipped");
            continue;
          }
          sent += processUser(userId, runStart);
          processed++;
          services.metrics().recordUserResult(kind, "processed");
        } catch (ItopIntegrationException ex) {
          failed++;
          services.metrics().recordUserResult(kind, "failed");
          if (ex.isAuthInvalid()) {
            // 全リクエストは共有のアプリケーショントークンで送るため、利用者の状態は変えずに打ち切る
            logger.warn(
                "{} notification check aborted; itop rejected the application token reason={}",
                kind.value(),
                ex.reason());
            break;
          }
          logger.error(
              "{} notification check failed userId={} reason={}",
              kind.value(),
              userId,
              ex.reason(),
              ex);
        } catch (RuntimeException ex) {
          failed++;
          services.metrics().recordUserResult(kind, "failed");
          logger.error("{} notification check failed userId={}", kind.value(), userId, ex);
        } finally {
          MDC.remove(MDC_USER_ID);
        }
      }
      final Duration duration = Duration.between(runStart, Instant.now(clock));
      services.metrics().recordRunDuration(kind, duration);
      logger.info(
          "{} notification check completed processed={} skipped={} failed={} sent={} durationMs={}",
          kind.value(),
          processed,
          skipped,
          failed,
          sent,
          duration.toMillis());
      return new JobRunSummary(kind, processed, skipped, failed, sent, duration);
    } finally {
      MDC.remove(MDC_JOB);
    }
  }

  int processUser(String userId, Instant runStart) {
    final NotificationSettingsRepository settings = services.settingsRepository();
    final WatermarkRepository watermarks = services.watermarkRepository();
    final String personId =
        settings
            .findPersonId(userId)
            .orElseThrow(() -> new IllegalStateException("user has no itop identity binding"));
    final NotificationTarget target =
        new NotificationTarget(userId, personId, settings.findItopUserId(userId).orElse(null));
    final Instant since =
        watermarks
            .find(userId, kind)
            .orElseGet(() -> runStart.minus(services.properties().firstRunLookback()));
    final Set<NotificationType> enabled =
        services
            .policyResolver()
            .enabledTypes(
                kind, settings.findAdminPolicies(kind), settings.findOptOut(userId, kind));
    if (enabled.isEmpty()) {
      watermarks.save(userId, kind, runStart);
      return 0;
    }
    final NotificationBudget budget =
        new NotificationBudget(services.properties().maxNotificationsPerRun());
    detect(target, enabled, since, runStart, budget);
    if (budget.isExhausted()) {
      logger.debug("notification cap reached userId={} cap={}", userId, budget.used());
    }
    watermarks.save(userId, kind, runStart);
    return budget.used();
  }

  /**
   * 利用者 1 人分の検出手順を固定順で実行する。
   *
   * <p>上限に達したら以降の手順は実行しない。
   */
  protected abstract void detect(
      NotificationTarget target,
      Set<NotificationType> enabled,
      Instant since,
      Instant now,
      NotificationBudget budget);

  protected static Map<String, String> ticketParams(ChangeRecord change) {
    final Map<String, String> params = new LinkedHashMap<>();
    params.put("ticket_id", change.objectKey());
    params.put("ticket_class", change.objectClass());
    params.put("timestamp", change.date());
    return params;
  }
}
