/*
 * どこで: CreditGrantJobRepository の統合テスト
 * 何を: claim/完了/失敗/再投入の状態遷移を検証する
 * なぜ: webhook 直後の付与と sweep が同じジョブを二重に完了させないことを保証するため
 */
package com.example.publisher.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.publisher.AbstractPostgresContainerTest;
import com.example.publisher.model.CreditGrantJob;
import com.example.publisher.model.GrantJobStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class CreditGrantJobRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
  private static final Duration LEASE = Duration.ofSeconds(60);

  @Autowired private CreditGrantJobRepository jobRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM credit_grant_jobs", new MapSqlParameterSource());
  }

  @Test
  void claimPendingSkipsJobsBeforeNextRetryAt() {
    final UUID due = insert("evt_due", NOW.minusSeconds(1));
    insert("evt_later", NOW.plusSeconds(30));

    final List<CreditGrantJob> claimed =
        jobRepository.claimPending(10, NOW, NOW.plus(LEASE), "worker-1");

    assertThat(claimed).extracting(CreditGrantJob::jobId).containsExactly(due);
    assertThat(jobRepository.findStatus(due)).hasValue(GrantJobStatus.IN_FLIGHT);
  }

  @Test
  void inlineCompletionLosesToSweepClaim() {
    final UUID jobId = insert("evt_1", NOW);
    jobRepository.claimPending(10, NOW, NOW.plus(LEASE), "worker-1");

    // webhook 直後の付与は PENDING のときだけ完了にできる
    assertThat(jobRepository.markCompleted(jobId, null, "WALLET", NOW)).isZero();
    assertThat(jobRepository.markCompleted(jobId, "worker-2", "WALLET", NOW)).isZero();
    assertThat(jobRepository.markCompleted(jobId, "worker-1", "WALLET", NOW)).isEqualTo(1);
    assertThat(jobRepository.findStatus(jobId)).hasValue(GrantJobStatus.COMPLETED);
  }

  @Test
  void completedJobIsNotClaimedAgain() {
    final UUID jobId = insert("evt_1", NOW);
    assertThat(jobRepository.markCompleted(jobId, null, "ACCOUNT:key_a", NOW)).isEqualTo(1);

    final List<CreditGrantJob> claimed =
        jobRepository.claimPending(10, NOW.plusSeconds(3600), NOW.plusSeconds(3660), "worker-1");

    assertThat(claimed).isEmpty();
  }

  @Test
  void expiredLeaseIsReclaimed() {
    final UUID jobId = insert("evt_1", NOW);
    jobRepository.claimPending(10, NOW, NOW.plus(LEASE), "worker-1");

    final List<CreditGrantJob> reclaimed =
        jobRepository.claimPending(10, NOW.plus(LEASE), NOW.plus(LEASE).plus(LEASE), "worker-2");

    assertThat(reclaimed).extracting(CreditGrantJob::jobId).containsExactly(jobId);
  }

  @Test
  void failedJobCanBeRequeued() {
    final UUID jobId = insert("evt_1", NOW);
    jobRepository.claimPending(10, NOW, NOW.plus(LEASE), "worker-1");
    assertThat(
            jobRepository.markFailure(
                jobId, "worker-1", 10, GrantJobStatus.FAILED, null, "boom"))
        .isEqualTo(1);
    assertThat(jobRepository.countFailed()).isEqualTo(1);

    assertThat(jobRepository.requeueFailed(jobId, NOW)).isEqualTo(1);
    assertThat(jobRepository.requeueFailed(jobId, NOW)).isZero();

    final CreditGrantJob job = jobRepository.findById(jobId).orElseThrow();
    assertThat(job.attemptCount()).isZero();
    assertThat(jobRepository.findStatus(jobId)).hasValue(GrantJobStatus.PENDING);
    assertThat(jobRepository.countFailed()).isZero();
  }

  @Test
  void deleteCompletedOlderThanKeepsPendingJobs() {
    final UUID completed = insert("evt_done", NOW.minusSeconds(7200));
    jobRepository.markCompleted(completed, null, "WALLET", NOW.minusSeconds(7200));
    final UUID pending = insert("evt_pending", NOW.minusSeconds(7200));

    final int deleted = jobRepository.deleteCompletedOlderThan(NOW);

    assertThat(deleted).isEqualTo(1);
    assertThat(jobRepository.findById(completed)).isEmpty();
    assertThat(jobRepository.findById(pending)).isPresent();
  }

  private UUID insert(String eventId, Instant nextRetryAt) {
    final UUID jobId = UUID.randomUUID();
    jobRepository.insert(jobId, eventId, "user-1", 5L, NOW.minusSeconds(10), nextRetryAt);
    return jobId;
  }
}
