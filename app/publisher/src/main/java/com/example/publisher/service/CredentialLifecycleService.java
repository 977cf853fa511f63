/*
 * どこで: Publisher サービス層
 * 何を: 期限切れ間近のトークンを更新し、常に残り有効期間が閾値以上のトークンを返す
 * なぜ: 回転型 refresh token を重複更新で失効させず、全アダプタが同じ規則で認証できるようにするため
 */
package com.example.publisher.service;

import com.example.common.concurrent.SingleFlight;
import com.example.common.lock.AdvisoryLockKeys;
import com.example.publisher.config.CredentialProperties;
import com.example.publisher.config.CredentialProperties.ProviderSettings;
import com.example.publisher.model.AccessToken;
import com.example.publisher.model.CredentialRecord;
import com.example.publisher.model.OwnerIdentity;
import com.example.publisher.model.Provider;
import com.example.publisher.repository.AdvisoryLockRepository;
import com.example.publisher.repository.CredentialRepository;
import com.example.publisher.service.dto.ConnectionSummary;
import com.example.publisher.service.dto.TokenGrant;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class CredentialLifecycleService {

  private static final Logger logger = LoggerFactory.getLogger(CredentialLifecycleService.class);
  private static final String LOCK_NAMESPACE = "credential";

  private final CredentialRepository credentialRepository;
  private final AdvisoryLockRepository advisoryLockRepository;
  private final TokenEndpointClient tokenEndpointClient;
  private final CredentialProperties properties;
  private final TransactionTemplate transactionTemplate;
  private final PublisherMetrics metrics;
  private final Clock clock;
  private final SingleFlight<String, CredentialRecord> refreshFlights = new SingleFlight<>();

  public AccessToken getValidAccessToken(String ownerKey, Provider provider) {
    return getValidAccessToken(OwnerIdentity.ofOwner(ownerKey), provider);
  }

  /**
   * 役割:
   * - 識別子の優先順(プロバイダ ID > 内部 ID > メール)で資格情報を引き、有効なトークンを返す。
   *
   * 期待動作:
   * - 残り有効期間が閾値未満なら、更新して永続化してから返す。
   * - 同一 (owner, provider) の更新はプロセス内/プロセス間ともに 1 本に束ねる。
   */
  public AccessToken getValidAccessToken(OwnerIdentity identity, Provider provider) {
    if (identity == null || identity.isEmpty()) {
      throw new IllegalArgumentException("owner identity is required");
    }
    final CredentialRecord record =
        resolve(identity, provider)
            .orElseThrow(
                () ->
                    new CredentialException(
                        CredentialException.Reason.NOT_CONNECTED,
                        provider + " is not connected"));
    if (!record.expiresWithin(properties.refreshThreshold(), Instant.now(clock))) {
      return record.toAccessToken();
    }
    final String ownerKey = record.ownerKey();
    final CredentialRecord refreshed =
        refreshFlights.execute(
            flightKey(ownerKey, provider), () -> refreshSerialized(ownerKey, provider));
    return refreshed.toAccessToken();
  }

  public ConnectionSummary connect(
      String ownerKey,
      Provider provider,
      String code,
      String redirectUri,
      String providerUserId,
      String email) {
    requireOwnerKey(ownerKey);
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("code is required");
    }
    final ProviderSettings settings = properties.settingsFor(provider);
    final TokenGrant grant =
        tokenEndpointClient.exchangeAuthorizationCode(provider, settings, code, redirectUri);
    final Instant now = Instant.now(clock);
    final CredentialRecord record =
        new CredentialRecord(
            ownerKey,
            provider,
            grant.providerUserId() != null ? grant.providerUserId() : providerUserId,
            email,
            grant.accessToken(),
            grant.refreshToken(),
            grant.tokenType(),
            grant.scope(),
            expiresAt(grant, now),
            settings.rotatesRefreshToken(),
            now);
    transactionTemplate.executeWithoutResult(
        status -> {
          // 進行中の更新と入れ替わらないよう同じロックで直列化する
          advisoryLockRepository.lock(lockKey(ownerKey, provider));
          credentialRepository.upsert(record, now);
        });
    metrics.recordRefresh(provider.name(), "connected");
    logger.info(
        "credential connected ownerKey={} provider={} expiresAt={} refreshable={}",
        ownerKey,
        provider,
        record.expiresAt(),
        record.hasRefreshToken());
    return ConnectionSummary.from(record);
  }

  public void disconnect(String ownerKey, Provider provider) {
    requireOwnerKey(ownerKey);
    final Integer deleted =
        transactionTemplate.execute(
            status -> {
              advisoryLockRepository.lock(lockKey(ownerKey, provider));
              return credentialRepository.delete(ownerKey, provider);
            });
    if (deleted == null || deleted == 0) {
      throw new CredentialException(
          CredentialException.Reason.NOT_CONNECTED, provider + " is not connected");
    }
    logger.info("credential disconnected ownerKey={} provider={}", ownerKey, provider);
  }

  public List<ConnectionSummary> listConnections(String ownerKey) {
    requireOwnerKey(ownerKey);
    return credentialRepository.findByOwner(ownerKey).stream()
        .map(ConnectionSummary::from)
        .toList();
  }

  private Optional<CredentialRecord> resolve(OwnerIdentity identity, Provider provider) {
    // プロバイダ側 ID は別アカウントへ再割り当てされないため最優先で照合する
    if (hasText(identity.providerUserId())) {
      final Optional<CredentialRecord> byProviderId =
          credentialRepository.findByProviderUserId(provider, identity.providerUserId());
      if (byProviderId.isPresent()) {
        return byProviderId;
      }
    }
    if (hasText(identity.ownerKey())) {
      final Optional<CredentialRecord> byOwner =
          credentialRepository.find(identity.ownerKey(), provider);
      if (byOwner.isPresent()) {
        return byOwner;
      }
    }
    if (hasText(identity.email())) {
      return credentialRepository.findByEmail(provider, identity.email());
    }
    return Optional.empty();
  }

  private CredentialRecord refreshSerialized(String ownerKey, Provider provider) {
    return transactionTemplate.execute(
        status -> {
          advisoryLockRepository.lock(lockKey(ownerKey, provider));
          final CredentialRecord current =
              credentialRepository
                  .find(ownerKey, provider)
                  .orElseThrow(
                      () ->
                          new CredentialException(
                              CredentialException.Reason.NOT_CONNECTED,
                              provider + " is not connected"));
          final Instant now = Instant.now(clock);
          if (!current.expiresWithin(properties.refreshThreshold(), now)) {
            // ロック待ちの間に別インスタンスが更新済み
            metrics.recordRefresh(provider.name(), "already_fresh");
            return current;
          }
          return refresh(current, now);
        });
  }

  private CredentialRecord refresh(CredentialRecord current, Instant now) {
    final Provider provider = current.provider();
    if (!current.hasRefreshToken()) {
      metrics.recordRefresh(provider.name(), "auth_expired");
      logger.warn(
          "credential cannot be refreshed without refresh token ownerKey={} provider={}",
          current.ownerKey(),
          provider);
      throw new CredentialException(
          CredentialException.Reason.AUTH_EXPIRED,
          provider + " authorization expired and cannot be refreshed");
    }
    final TokenGrant grant;
    try {
      grant =
          tokenEndpointClient.refresh(
              provider, properties.settingsFor(provider), current.refreshToken());
    } catch (CredentialException ex) {
      metrics.recordRefresh(provider.name(), ex.reason().name().toLowerCase(Locale.ROOT));
      logger.warn(
          "credential refresh failed ownerKey={} provider={} reason={}",
          current.ownerKey(),
          provider,
          ex.reason());
      throw ex;
    }
    final Instant expiresAt = refreshedExpiry(current, grant, now);
    // refresh token は新しい値が返った場合だけ差し替える
    final String newRefreshToken = grant.hasRefreshToken() ? grant.refreshToken() : null;
    final int updated =
        credentialRepository.replaceTokens(
            current.ownerKey(),
            provider,
            grant.accessToken(),
            newRefreshToken,
            grant.tokenType(),
            grant.scope(),
            expiresAt,
            now);
    if (updated == 0) {
      throw new CredentialException(
          CredentialException.Reason.NOT_CONNECTED, provider + " was disconnected during refresh");
    }
    final boolean rotated =
        newRefreshToken != null && !newRefreshToken.equals(current.refreshToken());
    if (current.rotatesRefreshToken() && !rotated) {
      logger.warn(
          "rotating provider returned no new refresh token ownerKey={} provider={}",
          current.ownerKey(),
          provider);
    }
    if (expiresAt != null
        && Duration.between(now, expiresAt).compareTo(properties.refreshThreshold()) < 0) {
      logger.warn(
          "refreshed token lifetime is shorter than threshold ownerKey={} provider={} expiresAt={}",
          current.ownerKey(),
          provider,
          expiresAt);
    }
    metrics.recordRefresh(provider.name(), "success");
    logger.info(
        "credential refreshed ownerKey={} provider={} expiresAt={} refreshTokenRotated={}",
        current.ownerKey(),
        provider,
        expiresAt,
        rotated);
    return new CredentialRecord(
        current.ownerKey(),
        provider,
        current.providerUserId(),
        current.email(),
        grant.accessToken(),
        newRefreshToken != null ? newRefreshToken : current.refreshToken(),
        grant.tokenType() != null ? grant.tokenType() : current.tokenType(),
        grant.scope() != null ? grant.scope() : current.scope(),
        expiresAt,
        current.rotatesRefreshToken(),
        now);
  }

  /**
   * 更新応答に expires_in が無い場合は直前のトークン寿命を引き継ぐ。
   *
   * <p>既知の期限を NULL で上書きすると以後更新されなくなるため、寿命が分からなければ一時障害として扱う。
   */
  private Instant refreshedExpiry(CredentialRecord current, TokenGrant grant, Instant now) {
    if (grant.expiresInSeconds() != null || current.expiresAt() == null) {
      return expiresAt(grant, now);
    }
    final Instant issuedAt = current.lastRefreshedAt();
    if (issuedAt != null && issuedAt.isBefore(current.expiresAt())) {
      final Duration lifetime = Duration.between(issuedAt, current.expiresAt());
      logger.warn(
          "refresh response has no expires_in, carrying previous lifetime ownerKey={} provider={}"
              + " lifetime={}",
          current.ownerKey(),
          current.provider(),
          lifetime);
      return now.plus(lifetime);
    }
    metrics.recordRefresh(current.provider().name(), "upstream_unavailable");
    logger.warn(
        "refresh response has no expires_in and previous lifetime is unknown ownerKey={}"
            + " provider={}",
        current.ownerKey(),
        current.provider());
    throw new CredentialException(
        CredentialException.Reason.UPSTREAM_UNAVAILABLE,
        current.provider() + " token response did not include an expiry");
  }

  private static Instant expiresAt(TokenGrant grant, Instant now) {
    return grant.expiresInSeconds() == null ? null : now.plusSeconds(grant.expiresInSeconds());
  }

  private static long lockKey(String ownerKey, Provider provider) {
    return AdvisoryLockKeys.of(LOCK_NAMESPACE, flightKey(ownerKey, provider));
  }

  private static String flightKey(String ownerKey, Provider provider) {
    return ownerKey + ":" + provider.name();
  }

  private static void requireOwnerKey(String ownerKey) {
    if (!hasText(ownerKey)) {
      throw new IllegalArgumentException("ownerKey is required");
    }
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
