/*
 * どこで: iTop 通知アプリのスモークテスト
 * 何を: Spring コンテキストの起動を確認する
 * なぜ: 設定バインドと Bean 構成が壊れていないことを担保するため
 */
package com.example.itop_notification;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ItopNotificationApplicationTests extends AbstractPostgresContainerTest {

  @Test
  void contextLoads() {}
}
