/*
 * どこで: iTop 通知ドメインモデル
 * 何を: 利用者が無効化した通知種別(または全無効)を保持する
 * なぜ: 管理者ポリシーとの合成を純粋関数で扱うため
 */
package com.example.itop_notification.model;

import java.util.Set;

public record UserOptOut(boolean all, Set<String> subjects) {

  public static final String ALL = "all";

  public UserOptOut {
    subjects = subjects == null ? Set.of() : Set.copyOf(subjects);
  }

  public static UserOptOut none() {
    return new UserOptOut(false, Set.of());
  }

  public static UserOptOut everything() {
    return new UserOptOut(true, Set.of());
  }

  public boolean optedOut(NotificationType type) {
    return all || subjects.contains(type.subject());
  }
}
