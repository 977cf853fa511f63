/*
 * どこで: Publisher データアクセス
 * 何を: api_key_accounts の作成/条件付き減算/加算/失効を担う
 * なぜ: 残高更新を条件付き UPDATE に閉じ込め、読み取り後書き込みの競合を無くすため
 */
package com.example.publisher.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.publisher.model.AccountStatus;
import com.example.publisher.model.ApiKeyAccount;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class ApiKeyAccountRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public ApiKeyAccountRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // SpotBugs の EI_EXPOSE_REP2 対応: 外部参照を直接保持せず、ラッパを作り直す
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  public int insert(
      String accountId, String ownerKey, long initialGrant, Instant createdAt) {
    final String sql =
        """
        INSERT INTO api_key_accounts (
          account_id, owner_key, balance, initial_grant, total_consumed, status, created_at
        ) VALUES (
          :accountId, :ownerKey, :initialGrant, :initialGrant, 0, 'ACTIVE', :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("accountId", accountId)
            .addValue("ownerKey", ownerKey)
            .addValue("initialGrant", initialGrant)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<ApiKeyAccount> findById(String accountId) {
    final String sql =
        """
        SELECT account_id, owner_key, balance, initial_grant, total_consumed, status, created_at
        FROM api_key_accounts
        WHERE account_id = :accountId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("accountId", accountId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** 新しい順(作成日時、同時刻は account_id の降順)で返す。 */
  public List<ApiKeyAccount> findByOwner(String ownerKey) {
    final String sql =
        """
        SELECT account_id, owner_key, balance, initial_grant, total_consumed, status, created_at
        FROM api_key_accounts
        WHERE owner_key = :ownerKey
        ORDER BY created_at DESC, account_id DESC
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerKey", ownerKey);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<ApiKeyAccount> findNewestActive(String ownerKey) {
    final String sql =
        """
        SELECT account_id, owner_key, balance, initial_grant, total_consumed, status, created_at
        FROM api_key_accounts
        WHERE owner_key = :ownerKey
          AND status = 'ACTIVE'
        ORDER BY created_at DESC, account_id DESC
        LIMIT 1
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerKey", ownerKey);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int countByOwner(String ownerKey) {
    final String sql = "SELECT COUNT(*) FROM api_key_accounts WHERE owner_key = :ownerKey";
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("ownerKey", ownerKey), Integer.class);
    return count == null ? 0 : count;
  }

  /**
   * balance >= amount のときだけ減算する。
   *
   * @return 減算後の残高。条件不成立(残高不足/失効/不存在)なら empty
   */
  public OptionalLong decrementIfSufficient(String accountId, long amount) {
    final String sql =
        """
        UPDATE api_key_accounts
        SET balance = balance - :amount,
            total_consumed = total_consumed + :amount
        WHERE account_id = :accountId
          AND status = 'ACTIVE'
          AND balance >= :amount
        RETURNING balance
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("accountId", accountId).addValue("amount", amount);
    final List<Long> remaining =
        jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getLong("balance"));
    return remaining.isEmpty() ? OptionalLong.empty() : OptionalLong.of(remaining.get(0));
  }

  public int increment(String accountId, String ownerKey, long amount) {
    final String sql =
        """
        UPDATE api_key_accounts
        SET balance = balance + :amount
        WHERE account_id = :accountId
          AND owner_key = :ownerKey
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("accountId", accountId)
            .addValue("ownerKey", ownerKey)
            .addValue("amount", amount);
    return jdbcTemplate.update(sql, params);
  }

  public long sumBalanceByOwner(String ownerKey) {
    final String sql =
        "SELECT COALESCE(SUM(balance), 0) FROM api_key_accounts WHERE owner_key = :ownerKey";
    final Long sum =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("ownerKey", ownerKey), Long.class);
    return sum == null ? 0L : sum;
  }

  public int revoke(String accountId, String ownerKey, Instant revokedAt) {
    final String sql =
        """
        UPDATE api_key_accounts
        SET status = 'REVOKED',
            revoked_at = :revokedAt
        WHERE account_id = :accountId
          AND owner_key = :ownerKey
          AND status = 'ACTIVE'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("accountId", accountId)
            .addValue("ownerKey", ownerKey)
            .addValue("revokedAt", toTimestamp(revokedAt));
    return jdbcTemplate.update(sql, params);
  }

  private ApiKeyAccount mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ApiKeyAccount(
        rs.getString("account_id"),
        rs.getString("owner_key"),
        rs.getLong("balance"),
        rs.getLong("initial_grant"),
        rs.getLong("total_consumed"),
        AccountStatus.valueOf(rs.getString("status")),
        rs.getTimestamp("created_at").toInstant());
  }
}
