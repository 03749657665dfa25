/*
 * どこで: iTop 通知ドメインモデル
 * 何を: 通知先の Nextcloud 利用者と紐づく iTop 識別子
 * なぜ: 自己通知抑止を iTop 側の識別子で判定するため
 */
package com.example.itop_notification.model;

public record NotificationTarget(String userId, String personId, String itopUserId) {

  public boolean isActor(String actorUserId) {
    return itopUserId != null
        && !itopUserId.isBlank()
        && actorUserId != null
        && itopUserId.equals(actorUserId);
  }
}
