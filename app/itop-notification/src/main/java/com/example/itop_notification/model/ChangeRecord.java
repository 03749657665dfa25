/*
 * どこで: iTop 通知ドメインモデル
 * 何を: iTop の変更ログ(CMDBChangeOp)1 件を表す
 * なぜ: スカラー変更とケースログ変更を同じ形で検出処理へ渡すため
 */
package com.example.itop_notification.model;

import java.util.Objects;

public record ChangeRecord(
    String objectKey,
    String objectClass,
    String attributeCode,
    String oldValue,
    String newValue,
    String date,
    String userInfo,
    String actorUserId) {

  public boolean isNoOp() {
    return Objects.equals(oldValue, newValue);
  }

  public boolean isSystemGenerated() {
    return actorUserId == null || actorUserId.isBlank() || "0".equals(actorUserId);
  }
}
