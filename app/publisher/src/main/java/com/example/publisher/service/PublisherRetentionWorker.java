package com.example.publisher.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "publisher.retention.enabled", havingValue = "true")
public class PublisherRetentionWorker {

  private final PublisherRetentionService retentionService;

  @Scheduled(fixedDelayString = "${publisher.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
