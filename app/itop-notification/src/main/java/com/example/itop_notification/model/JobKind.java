/*
 * どこで: iTop 通知ドメインモデル
 * 何を: 通知ジョブの種別(ポータル利用者向け/エージェント向け)
 * なぜ: ウォーターマークや通知種別の名前空間をジョブごとに分けるため
 */
package com.example.itop_notification.model;

import java.util.Locale;

public enum JobKind {
  PORTAL("portal"),
  AGENT("agent");

  private final String value;

  JobKind(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static JobKind fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("job kind is required");
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (JobKind kind : values()) {
      if (kind.value.equals(normalized)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("unknown job kind: " + value);
  }
}
