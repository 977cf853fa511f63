/*
 * どこで: Publisher retention サービス
 * 何を: 完了済みの古い付与ジョブを削除する
 * なぜ: テーブル肥大化を防ぎ、運用負荷を下げるため
 */
package com.example.publisher.service;

import com.example.publisher.config.PublisherRetentionProperties;
import com.example.publisher.repository.CreditGrantJobRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PublisherRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(PublisherRetentionService.class);

  private final CreditGrantJobRepository jobRepository;
  private final PublisherRetentionProperties properties;
  private final Clock clock;

  public void cleanup() {
    // processed_events は消さない。消すと古い webhook の再送で二重付与になる
    // 付与ジョブは完了済みのみ対象にし、PENDING/FAILED は残す
    final Instant jobThreshold = Instant.now(clock).minus(properties.completedGrantTtl());
    final int deletedJobs = jobRepository.deleteCompletedOlderThan(jobThreshold);
    logger.info(
        "publisher retention cleanup deleted creditGrantJobs={} jobThreshold={}",
        deletedJobs,
        jobThreshold);
  }
}
