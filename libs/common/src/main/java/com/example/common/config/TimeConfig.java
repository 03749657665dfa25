/*
 * どこで: 共通設定
 * 何を: UTC の Clock を DI 可能にする
 * なぜ: 時刻依存の判定(実行間隔/SLA 期限/キャッシュ年齢)をテストで固定時刻に差し替えるため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
