/*
 * どこで: Publisher データアクセス
 * 何を: credit_grant_jobs の登録/claim/完了/失敗記録を担う
 * なぜ: マーカー作成後に失敗した付与を取りこぼさず再試行するため
 */
package com.example.publisher.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.publisher.model.CreditGrantJob;
import com.example.publisher.model.GrantJobStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class CreditGrantJobRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public CreditGrantJobRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // SpotBugs の EI_EXPOSE_REP2 対応: 外部参照を直接保持せず、ラッパを作り直す
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  public int insert(
      UUID jobId,
      String eventId,
      String ownerKey,
      long credits,
      Instant createdAt,
      Instant nextRetryAt) {
    final String sql =
        """
        INSERT INTO credit_grant_jobs (
          job_id,
          event_id,
          owner_key,
          credits,
          status,
          attempt_count,
          next_retry_at,
          created_at
        ) VALUES (
          :jobId,
          :eventId,
          :ownerKey,
          :credits,
          'PENDING',
          0,
          :nextRetryAt,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("eventId", eventId)
            .addValue("ownerKey", ownerKey)
            .addValue("credits", credits)
            .addValue("nextRetryAt", toTimestamp(nextRetryAt))
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<CreditGrantJob> findById(UUID jobId) {
    final String sql =
        """
        SELECT job_id, event_id, owner_key, credits, attempt_count
        FROM credit_grant_jobs
        WHERE job_id = :jobId
        """;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("jobId", jobId), this::mapRow)
        .stream()
        .findFirst();
  }

  public Optional<GrantJobStatus> findStatus(UUID jobId) {
    final String sql = "SELECT status FROM credit_grant_jobs WHERE job_id = :jobId";
    return jdbcTemplate
        .query(
            sql,
            new MapSqlParameterSource().addValue("jobId", jobId),
            (rs, rowNum) -> GrantJobStatus.valueOf(rs.getString("status")))
        .stream()
        .findFirst();
  }

  public List<CreditGrantJob> claimPending(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // PENDING とリース切れの IN_FLIGHT をまとめて claim する
    final String sql =
        """
        WITH cte AS (
          SELECT job_id
          FROM credit_grant_jobs
          WHERE (
            status = 'PENDING'
            AND (next_retry_at IS NULL OR next_retry_at <= :now)
          )
          OR (
            status = 'IN_FLIGHT'
            AND (lease_until IS NULL OR lease_until <= :now)
          )
          ORDER BY created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE credit_grant_jobs j
        SET status = 'IN_FLIGHT',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil
        FROM cte
        WHERE j.job_id = cte.job_id
        RETURNING j.job_id, j.event_id, j.owner_key, j.credits, j.attempt_count
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * 未完了のジョブを完了にする。付与と同じトランザクションで呼ぶこと。
   *
   * @param lockedBy sweep が claim した場合はその所有者、webhook 直後の付与なら null
   * @return 1=このトランザクションが完了させた、0=既に完了済みか他者が claim 中
   */
  public int markCompleted(UUID jobId, String lockedBy, String destination, Instant completedAt) {
    // webhook 直後の付与は PENDING のまま、sweep は自分が claim した IN_FLIGHT のみを完了にする
    final String ownershipCondition =
        lockedBy == null
            ? "status = 'PENDING'"
            : "status = 'IN_FLIGHT' AND locked_by = :lockedBy";
    final String sql =
        """
        UPDATE credit_grant_jobs
        SET status = 'COMPLETED',
            destination = :destination,
            completed_at = :completedAt,
            next_retry_at = NULL,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            last_error = NULL
        WHERE job_id = :jobId
          AND\s"""
            + ownershipCondition;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("destination", destination)
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailure(
      UUID jobId,
      String lockedBy,
      int attemptCount,
      GrantJobStatus status,
      Instant nextRetryAt,
      String lastError) {
    final String sql =
        """
        UPDATE credit_grant_jobs
        SET attempt_count = :attemptCount,
            status = :status,
            next_retry_at = :nextRetryAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            last_error = :lastError
        WHERE job_id = :jobId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attemptCount", attemptCount)
            .addValue("status", status.name())
            .addValue("nextRetryAt", toTimestamp(nextRetryAt))
            .addValue("lastError", lastError)
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /** FAILED のジョブを運用判断で再投入する。 */
  public int requeueFailed(UUID jobId, Instant nextRetryAt) {
    final String sql =
        """
        UPDATE credit_grant_jobs
        SET status = 'PENDING',
            attempt_count = 0,
            next_retry_at = :nextRetryAt
        WHERE job_id = :jobId
          AND status = 'FAILED'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("nextRetryAt", toTimestamp(nextRetryAt));
    return jdbcTemplate.update(sql, params);
  }

  public int deleteCompletedOlderThan(Instant threshold) {
    // 完了済みのみ対象にし、未完了/失敗は残す。
    final String sql =
        """
        DELETE FROM credit_grant_jobs
        WHERE status = 'COMPLETED'
          AND completed_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countFailed() {
    final String sql = "SELECT COUNT(*) FROM credit_grant_jobs WHERE status = 'FAILED'";
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  private CreditGrantJob mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CreditGrantJob(
        UUID.fromString(rs.getString("job_id")),
        rs.getString("event_id"),
        rs.getString("owner_key"),
        rs.getLong("credits"),
        rs.getInt("attempt_count"));
  }
}
