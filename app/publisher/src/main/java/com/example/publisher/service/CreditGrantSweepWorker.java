package com.example.publisher.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "publisher.billing.grant-sweep.enabled",
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class CreditGrantSweepWorker {

  private final CreditGrantSweepService sweepService;

  @Scheduled(fixedDelayString = "${publisher.billing.grant-sweep.poll-interval}")
  public void run() {
    sweepService.sweepPendingBatch();
  }
}
