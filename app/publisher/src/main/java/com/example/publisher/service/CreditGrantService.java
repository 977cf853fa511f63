/*
 * どこで: Publisher サービス層
 * 何を: 付与ジョブ 1 件を「完了マーク + クレジット加算」の 1 トランザクションで適用する
 * なぜ: webhook 直後の付与と sweep の再試行が重なっても二重付与しないため
 */
package com.example.publisher.service;

import com.example.publisher.model.CreditDestination;
import com.example.publisher.model.CreditGrantJob;
import com.example.publisher.repository.CreditGrantJobRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class CreditGrantService {

  private static final Logger logger = LoggerFactory.getLogger(CreditGrantService.class);

  private final CreditGrantJobRepository jobRepository;
  private final CreditLedgerService ledgerService;
  private final Clock clock;

  /**
   * @param lockedBy sweep が claim したときの所有者。webhook 直後なら null
   * @return 付与先。既に他の経路で完了していれば empty
   */
  @Transactional
  public Optional<CreditDestination> apply(CreditGrantJob job, String lockedBy) {
    final CreditDestination destination = ledgerService.resolveGrantDestination(job.ownerKey());
    final int updated =
        jobRepository.markCompleted(job.jobId(), lockedBy, destination.label(), Instant.now(clock));
    if (updated == 0) {
      logger.info(
          "credit grant job already handled elsewhere jobId={} eventId={}",
          job.jobId(),
          job.eventId());
      return Optional.empty();
    }
    ledgerService.grant(job.ownerKey(), job.credits(), destination);
    return Optional.of(destination);
  }
}
