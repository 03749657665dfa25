/*
 * どこで: iTop 通知ドメインモデル
 * 何を: 利用者をこのジョブ実行で処理するかの判定結果
 * なぜ: スキップ理由をログとデバッグ API に出すため
 */
package com.example.itop_notification.model;

import java.time.Instant;

public record SchedulingDecision(Outcome outcome, Instant nextEligibleAt) {

  public enum Outcome {
    ELIGIBLE,
    NOTIFICATIONS_DISABLED,
    NOT_CONFIGURED,
    PORTAL_ONLY,
    AGENT_OPTED_OUT,
    PROFILE_UNAVAILABLE,
    INTERVAL_NOT_ELAPSED
  }

  public static SchedulingDecision closed(Outcome outcome) {
    return new SchedulingDecision(outcome, null);
  }

  public boolean eligible() {
    return outcome == Outcome.ELIGIBLE;
  }
}
