/*
 * どこで: iTop 通知ジョブ
 * 何を: ポータル/エージェント両ジョブが共有する協調オブジェクト一式
 * なぜ: ジョブのコンストラクタ引数を揃え、テストでまとめて差し替えられるようにするため
 */
package com.example.itop_notification.service;

import com.example.itop_notification.config.ItopNotificationProperties;
import com.example.itop_notification.repository.NotificationSettingsRepository;
import com.example.itop_notification.repository.WatermarkRepository;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "保持するのは Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public record JobServices(
    ItopClient itopClient,
    NotificationSettingsRepository settingsRepository,
    WatermarkRepository watermarkRepository,
    UserScheduler userScheduler,
    NotificationPolicyResolver policyResolver,
    ChangeDetector changeDetector,
    NotificationDispatcher dispatcher,
    ItopQueryService queryService,
    NotificationJobMetrics metrics,
    ItopNotificationProperties properties,
    Clock clock) {}
