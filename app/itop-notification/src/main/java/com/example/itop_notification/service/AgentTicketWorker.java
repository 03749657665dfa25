/*
 * どこで: iTop 通知ワーカー
 * 何を: エージェント向け通知ジョブを一定間隔で起動する
 * なぜ: 手動操作なしで差分検出を回し続けるため
 */
package com.example.itop_notification.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "itop.notification.agent-job-enabled", havingValue = "true")
public class AgentTicketWorker {

  private final AgentTicketJob agentTicketJob;

  @Scheduled(fixedDelayString = "${itop.notification.agent-poll-interval:PT5M}")
  public void run() {
    agentTicketJob.run();
  }
}
