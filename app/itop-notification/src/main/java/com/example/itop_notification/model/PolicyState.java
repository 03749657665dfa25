/*
 * どこで: iTop 通知ドメインモデル
 * 何を: 管理者が通知種別ごとに設定する 3 状態ポリシー
 * なぜ: 強制/無効/利用者選択を型で表現するため
 */
package com.example.itop_notification.model;

import java.util.Optional;

public enum PolicyState {
  DISABLED("disabled"),
  FORCED("forced"),
  USER_CHOICE("user_choice");

  private final String value;

  PolicyState(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static Optional<PolicyState> fromValue(String value) {
    for (PolicyState state : values()) {
      if (state.value.equals(value)) {
        return Optional.of(state);
      }
    }
    return Optional.empty();
  }
}
