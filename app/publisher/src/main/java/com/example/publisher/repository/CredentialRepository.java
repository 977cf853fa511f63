/*
 * どこで: Publisher データアクセス
 * 何を: credentials の登録/参照/トークン置換を担う
 * なぜ: (owner, provider) ごとの資格情報を 1 文で原子的に更新するため
 */
package com.example.publisher.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.publisher.model.CredentialRecord;
import com.example.publisher.model.Provider;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CredentialRepository {

  private static final String COLUMNS =
      """
      owner_key, provider, provider_user_id, email, access_token, refresh_token,
      token_type, scope, expires_at, rotates_refresh_token, last_refreshed_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<CredentialRecord> find(String ownerKey, Provider provider) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM credentials WHERE owner_key = :ownerKey AND provider = :provider";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerKey", ownerKey)
            .addValue("provider", provider.name());
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<CredentialRecord> findByProviderUserId(Provider provider, String providerUserId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM credentials
            WHERE provider = :provider
              AND provider_user_id = :providerUserId
            ORDER BY updated_at DESC
            LIMIT 1
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("provider", provider.name())
            .addValue("providerUserId", providerUserId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<CredentialRecord> findByEmail(Provider provider, String email) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM credentials
            WHERE provider = :provider
              AND lower(email) = lower(:email)
            ORDER BY updated_at DESC
            LIMIT 1
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("provider", provider.name()).addValue("email", email);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<CredentialRecord> findByOwner(String ownerKey) {
    final String sql =
        "SELECT " + COLUMNS + " FROM credentials WHERE owner_key = :ownerKey ORDER BY provider";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerKey", ownerKey);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** 認可コード交換の結果で (owner, provider) の資格情報を丸ごと置き換える。 */
  public int upsert(CredentialRecord record, Instant now) {
    final String sql =
        """
        INSERT INTO credentials (
          owner_key, provider, provider_user_id, email, access_token, refresh_token,
          token_type, scope, expires_at, rotates_refresh_token, last_refreshed_at,
          created_at, updated_at
        ) VALUES (
          :ownerKey, :provider, :providerUserId, :email, :accessToken, :refreshToken,
          :tokenType, :scope, :expiresAt, :rotatesRefreshToken, :lastRefreshedAt,
          :now, :now
        )
        ON CONFLICT (owner_key, provider) DO UPDATE
          SET provider_user_id      = EXCLUDED.provider_user_id,
              email                 = EXCLUDED.email,
              access_token          = EXCLUDED.access_token,
              refresh_token         = EXCLUDED.refresh_token,
              token_type            = EXCLUDED.token_type,
              scope                 = EXCLUDED.scope,
              expires_at            = EXCLUDED.expires_at,
              rotates_refresh_token = EXCLUDED.rotates_refresh_token,
              last_refreshed_at     = EXCLUDED.last_refreshed_at,
              updated_at            = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerKey", record.ownerKey())
            .addValue("provider", record.provider().name())
            .addValue("providerUserId", record.providerUserId())
            .addValue("email", record.email())
            .addValue("accessToken", record.accessToken())
            .addValue("refreshToken", record.refreshToken())
            .addValue("tokenType", record.tokenType())
            .addValue("scope", joinScope(record.scope()))
            .addValue("expiresAt", toTimestamp(record.expiresAt()))
            .addValue("rotatesRefreshToken", record.rotatesRefreshToken())
            .addValue("lastRefreshedAt", toTimestamp(record.lastRefreshedAt()))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * 更新結果でトークン一式を 1 文で置き換える。
   *
   * <p>refreshToken / scope / tokenType が null の場合は既存値を残す。
   */
  public int replaceTokens(
      String ownerKey,
      Provider provider,
      String accessToken,
      String refreshToken,
      String tokenType,
      Set<String> scope,
      Instant expiresAt,
      Instant refreshedAt) {
    final String sql =
        """
        UPDATE credentials
        SET access_token      = :accessToken,
            refresh_token     = COALESCE(:refreshToken, refresh_token),
            token_type        = COALESCE(:tokenType, token_type),
            scope             = COALESCE(:scope, scope),
            expires_at        = :expiresAt,
            last_refreshed_at = :refreshedAt,
            updated_at        = :refreshedAt
        WHERE owner_key = :ownerKey
          AND provider = :provider
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("accessToken", accessToken)
            .addValue("refreshToken", refreshToken)
            .addValue("tokenType", tokenType)
            .addValue("scope", scope == null ? null : joinScope(scope))
            .addValue("expiresAt", toTimestamp(expiresAt))
            .addValue("refreshedAt", toTimestamp(refreshedAt))
            .addValue("ownerKey", ownerKey)
            .addValue("provider", provider.name());
    return jdbcTemplate.update(sql, params);
  }

  public int delete(String ownerKey, Provider provider) {
    final String sql = "DELETE FROM credentials WHERE owner_key = :ownerKey AND provider = :provider";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerKey", ownerKey)
            .addValue("provider", provider.name());
    return jdbcTemplate.update(sql, params);
  }

  private CredentialRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CredentialRecord(
        rs.getString("owner_key"),
        Provider.valueOf(rs.getString("provider")),
        rs.getString("provider_user_id"),
        rs.getString("email"),
        rs.getString("access_token"),
        rs.getString("refresh_token"),
        rs.getString("token_type"),
        splitScope(rs.getString("scope")),
        toInstant(rs, "expires_at"),
        rs.getBoolean("rotates_refresh_token"),
        toInstant(rs, "last_refreshed_at"));
  }

  // scope は OAuth の表記に合わせて空白区切りで保存する
  private static String joinScope(Set<String> scope) {
    return scope.isEmpty() ? null : String.join(" ", scope);
  }

  private static Set<String> splitScope(String scope) {
    if (scope == null || scope.isBlank()) {
      return Set.of();
    }
    return Arrays.stream(scope.trim().split("[\\s,]+"))
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }
}
