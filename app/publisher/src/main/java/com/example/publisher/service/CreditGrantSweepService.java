/*
 * どこで: Publisher 付与 sweep サービス
 * 何を: 未完了の credit_grant_jobs を claim して付与を再試行する
 * なぜ: マーカー作成後に付与だけが失敗したケースを取りこぼさないため
 */
package com.example.publisher.service;

import com.example.publisher.config.CreditGrantSweepProperties;
import com.example.publisher.model.CreditDestination;
import com.example.publisher.model.CreditGrantJob;
import com.example.publisher.model.GrantJobStatus;
import com.example.publisher.repository.CreditGrantJobRepository;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CreditGrantSweepService {

  private static final Logger logger = LoggerFactory.getLogger(CreditGrantSweepService.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final CreditGrantJobRepository jobRepository;
  private final CreditGrantService creditGrantService;
  private final CreditGrantSweepProperties properties;
  private final PublisherMetrics metrics;
  private final Clock clock;

  /** @return このバッチで付与を完了させた件数 */
  public int sweepPendingBatch() {
    final Instant now = Instant.now(clock);
    final String lockedBy = resolveLockedBy();
    final Instant leaseUntil = now.plus(properties.lease());
    final List<CreditGrantJob> pending =
        jobRepository.claimPending(properties.batchSize(), now, leaseUntil, lockedBy);
    int completed = 0;
    for (CreditGrantJob job : pending) {
      try {
        final Optional<CreditDestination> destination = creditGrantService.apply(job, lockedBy);
        if (destination.isEmpty()) {
          logger.warn(
              "credit grant sweep lost lease before completion jobId={} eventId={}",
              job.jobId(),
              job.eventId());
          continue;
        }
        completed++;
        logger.info(
            "credit grant sweep completed jobId={} eventId={} ownerKey={} credits={} destination={}",
            job.jobId(),
            job.eventId(),
            job.ownerKey(),
            job.credits(),
            destination.get().label());
      } catch (RuntimeException ex) {
        handleFailure(job, ex, now, lockedBy);
      }
    }
    metrics.updateGrantFailedCurrent(jobRepository.countFailed());
    return completed;
  }

  /** FAILED になったジョブを運用者の判断で再投入する。 */
  public void requeueFailed(UUID jobId) {
    final int updated = jobRepository.requeueFailed(jobId, Instant.now(clock));
    if (updated == 0) {
      throw new GrantJobNotFoundException(jobId);
    }
    logger.info("credit grant job requeued jobId={}", jobId);
    metrics.updateGrantFailedCurrent(jobRepository.countFailed());
  }

  private void handleFailure(CreditGrantJob job, Exception ex, Instant now, String lockedBy) {
    final int nextAttempt = job.attemptCount() + 1;
    final boolean failed = nextAttempt >= properties.maxAttempts();
    final Instant nextRetryAt = failed ? null : now.plus(computeBackoffDuration(nextAttempt));
    final int updated =
        jobRepository.markFailure(
            job.jobId(),
            lockedBy,
            nextAttempt,
            failed ? GrantJobStatus.FAILED : GrantJobStatus.PENDING,
            nextRetryAt,
            truncateError(ex.getMessage()));
    if (updated == 0) {
      logger.warn(
          "credit grant retry skipped because lock was lost jobId={} attempt={}",
          job.jobId(),
          nextAttempt);
    }
    if (failed) {
      // 運用アラート向けに error レベルで通知する
      logger.error(
          "credit grant moved to FAILED jobId={} eventId={} ownerKey={} credits={}",
          job.jobId(),
          job.eventId(),
          job.ownerKey(),
          job.credits(),
          ex);
    } else {
      logger.warn(
          "credit grant retry scheduled jobId={} eventId={} attempt={} nextRetryAt={}",
          job.jobId(),
          job.eventId(),
          nextAttempt,
          nextRetryAt,
          ex);
    }
  }

  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    final long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  private String resolveLockedBy() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
