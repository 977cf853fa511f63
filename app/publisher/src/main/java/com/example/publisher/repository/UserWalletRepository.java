/*
 * どこで: Publisher データアクセス
 * 何を: user_wallets の残高と購入統計を条件付き/加算 UPDATE で更新する
 * なぜ: ウォレットの残高を負にせず、統計の二重計上も起こさないため
 */
package com.example.publisher.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.publisher.model.UserWallet;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserWalletRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UserWallet> find(String ownerKey) {
    final String sql =
        """
        SELECT owner_key, balance, total_paid_net, total_paid_gross, total_purchases,
               total_credits_purchased, last_purchase_at
        FROM user_wallets
        WHERE owner_key = :ownerKey
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerKey", ownerKey);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** @return 減算後の残高。ウォレットが無いか残高不足なら empty */
  public OptionalLong decrementIfSufficient(String ownerKey, long amount, Instant now) {
    final String sql =
        """
        UPDATE user_wallets
        SET balance = balance - :amount,
            updated_at = :now
        WHERE owner_key = :ownerKey
          AND balance >= :amount
        RETURNING balance
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerKey", ownerKey)
            .addValue("amount", amount)
            .addValue("now", toTimestamp(now));
    final List<Long> remaining =
        jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getLong("balance"));
    return remaining.isEmpty() ? OptionalLong.empty() : OptionalLong.of(remaining.get(0));
  }

  /** ウォレットが無ければ作成しつつ加算する。 */
  public long increment(String ownerKey, long amount, Instant now) {
    final String sql =
        """
        INSERT INTO user_wallets (owner_key, balance, created_at, updated_at)
        VALUES (:ownerKey, :amount, :now, :now)
        ON CONFLICT (owner_key) DO UPDATE
          SET balance = user_wallets.balance + EXCLUDED.balance,
              updated_at = EXCLUDED.updated_at
        RETURNING balance
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerKey", ownerKey)
            .addValue("amount", amount)
            .addValue("now", toTimestamp(now));
    final Long balance = jdbcTemplate.queryForObject(sql, params, Long.class);
    return balance == null ? 0L : balance;
  }

  public int recordPurchase(
      String ownerKey, long paidNet, long paidGross, long credits, Instant purchasedAt) {
    final String sql =
        """
        INSERT INTO user_wallets (
          owner_key, balance, total_paid_net, total_paid_gross, total_purchases,
          total_credits_purchased, last_purchase_at, created_at, updated_at
        ) VALUES (
          :ownerKey, 0, :paidNet, :paidGross, 1, :credits, :purchasedAt, :purchasedAt, :purchasedAt
        )
        ON CONFLICT (owner_key) DO UPDATE
          SET total_paid_net          = user_wallets.total_paid_net + EXCLUDED.total_paid_net,
              total_paid_gross        = user_wallets.total_paid_gross + EXCLUDED.total_paid_gross,
              total_purchases         = user_wallets.total_purchases + 1,
              total_credits_purchased =
                user_wallets.total_credits_purchased + EXCLUDED.total_credits_purchased,
              last_purchase_at        = EXCLUDED.last_purchase_at,
              updated_at              = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerKey", ownerKey)
            .addValue("paidNet", paidNet)
            .addValue("paidGross", paidGross)
            .addValue("credits", credits)
            .addValue("purchasedAt", toTimestamp(purchasedAt));
    return jdbcTemplate.update(sql, params);
  }

  private UserWallet mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserWallet(
        rs.getString("owner_key"),
        rs.getLong("balance"),
        rs.getLong("total_paid_net"),
        rs.getLong("total_paid_gross"),
        rs.getLong("total_purchases"),
        rs.getLong("total_credits_purchased"),
        toInstant(rs, "last_purchase_at"));
  }
}
