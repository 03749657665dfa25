/*
 * どこで: iTop 通知 API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: 起動確認を actuator なしでも行えるようにするため
 */
package com.example.itop_notification.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "itop-notification: ok";
  }
}
