/*
 * どこで: iTop 通知データアクセス
 * 何を: インスタンス単位/利用者単位の文字列キーバリュー設定ストア
 * なぜ: 型付きリポジトリから保存先の実装を切り離すため
 */
package com.example.itop_notification.repository;

import java.util.List;
import java.util.Optional;

public interface PreferenceStore {

  Optional<String> getAppValue(String key);

  void setAppValue(String key, String value);

  void deleteAppValue(String key);

  Optional<String> getUserValue(String userId, String key);

  void setUserValue(String userId, String key, String value);

  void deleteUserValue(String userId, String key);

  /** Every user that has at least one stored preference, in stable order. */
  List<String> findAllUserIds();
}
