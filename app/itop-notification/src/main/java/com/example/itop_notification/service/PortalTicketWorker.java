/*
 * Where: iTop notification worker
 * What: Triggers the portal ticket notification job on a schedule
 * Why: Keep submitter notifications flowing without manual runs
 */
package com.example.itop_notification.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "itop.notification.portal-job-enabled", havingValue = "true")
public class PortalTicketWorker {

  private final PortalTicketJob portalTicketJob;

  @Scheduled(fixedDelayString = "${itop.notification.portal-poll-interval:PT5M}")
  public void run() {
    portalTicketJob.run();
  }
}
