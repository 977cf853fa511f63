/*
 * どこで: CredentialLifecycleService の単体テスト
 * 何を: 閾値判定、refresh token の回転、失敗時の非更新、同時更新の単一化を検証する
 * なぜ: 回転型 refresh token を二重更新で失効させない振る舞いを固定するため
 */
package com.example.publisher.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class CredentialLifecycleServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
  private static final ProviderSettings TIKTOK_SETTINGS =
      new ProviderSettings(
          "http://tokens.test/tiktok", "ck", "cs", "client_key", true, "expires_in", "open_id");
  private static final ProviderSettings YOUTUBE_SETTINGS =
      new ProviderSettings("http://tokens.test/google", "gc", "gs", null, false, null, null);

  @Mock private CredentialRepository credentialRepository;
  @Mock private AdvisoryLockRepository advisoryLockRepository;
  @Mock private TokenEndpointClient tokenEndpointClient;

  private final AtomicReference<CredentialRecord> stored = new AtomicReference<>();
  private SimpleMeterRegistry meterRegistry;
  private CredentialLifecycleService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    final CredentialProperties properties =
        new CredentialProperties(
            Duration.ofSeconds(300),
            null,
            null,
            Map.of(Provider.TIKTOK, TIKTOK_SETTINGS, Provider.YOUTUBE, YOUTUBE_SETTINGS));
    service =
        new CredentialLifecycleService(
            credentialRepository,
            advisoryLockRepository,
            tokenEndpointClient,
            properties,
            new TransactionTemplate(mock(PlatformTransactionManager.class)),
            new PublisherMetrics(meterRegistry),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void returnsStoredTokenWithoutRefreshWhenLifetimeIsAboveThreshold() {
    givenStored(record(Provider.TIKTOK, "access-1", "refresh-1", NOW.plusSeconds(600), true));

    final AccessToken token = service.getValidAccessToken("user-1", Provider.TIKTOK);

    assertThat(token.value()).isEqualTo("access-1");
    verify(tokenEndpointClient, never()).refresh(any(), any(), anyString());
  }

  @Test
  void refreshesAndPersistsRotatedRefreshTokenWhenLifetimeIsBelowThreshold() {
    givenStored(record(Provider.TIKTOK, "access-1", "refresh-1", NOW.plusSeconds(200), true));
    when(tokenEndpointClient.refresh(Provider.TIKTOK, TIKTOK_SETTINGS, "refresh-1"))
        .thenReturn(new TokenGrant("access-2", "refresh-2", "Bearer", null, 86400L, null));

    final AccessToken token = service.getValidAccessToken("user-1", Provider.TIKTOK);

    assertThat(token.value()).isEqualTo("access-2");
    assertThat(token.expiresAt()).isEqualTo(NOW.plusSeconds(86400));
    assertThat(stored.get().refreshToken()).isEqualTo("refresh-2");
    assertThat(stored.get().lastRefreshedAt()).isEqualTo(NOW);
    verify(advisoryLockRepository).lock(anyLong());
    assertThat(refreshCount("TIKTOK", "success")).isEqualTo(1.0d);
  }

  @Test
  void keepsExistingRefreshTokenWhenProviderReturnsNone() {
    givenStored(record(Provider.YOUTUBE, "access-1", "refresh-1", NOW.plusSeconds(100), false));
    when(tokenEndpointClient.refresh(Provider.YOUTUBE, YOUTUBE_SETTINGS, "refresh-1"))
        .thenReturn(new TokenGrant("access-2", null, "Bearer", null, 3599L, null));

    final AccessToken token = service.getValidAccessToken("user-1", Provider.YOUTUBE);

    final ArgumentCaptor<String> refreshToken = ArgumentCaptor.forClass(String.class);
    verify(credentialRepository)
        .replaceTokens(
            eq("user-1"),
            eq(Provider.YOUTUBE),
            eq("access-2"),
            refreshToken.capture(),
            eq("Bearer"),
            any(),
            eq(NOW.plusSeconds(3599)),
            eq(NOW));
    assertThat(refreshToken.getValue()).isNull();
    assertThat(token.value()).isEqualTo("access-2");
    assertThat(stored.get().refreshToken()).isEqualTo("refresh-1");
  }

  @Test
  void rejectedRefreshLeavesRecordUnchanged() {
    final CredentialRecord original =
        record(Provider.TIKTOK, "access-1", "refresh-1", NOW.plusSeconds(10), true);
    givenStored(original);
    when(tokenEndpointClient.refresh(Provider.TIKTOK, TIKTOK_SETTINGS, "refresh-1"))
        .thenThrow(
            new CredentialException(CredentialException.Reason.AUTH_EXPIRED, "invalid_grant"));

    assertThatThrownBy(() -> service.getValidAccessToken("user-1", Provider.TIKTOK))
        .isInstanceOf(CredentialException.class)
        .extracting(ex -> ((CredentialException) ex).reason())
        .isEqualTo(CredentialException.Reason.AUTH_EXPIRED);
    assertThat(stored.get()).isSameAs(original);
    assertThat(refreshCount("TIKTOK", "auth_expired")).isEqualTo(1.0d);
  }

  @Test
  void upstreamFailureIsRetryableAndLeavesRecordUnchanged() {
    final CredentialRecord original =
        record(Provider.TIKTOK, "access-1", "refresh-1", NOW.minusSeconds(10), true);
    givenStored(original);
    when(tokenEndpointClient.refresh(Provider.TIKTOK, TIKTOK_SETTINGS, "refresh-1"))
        .thenThrow(
            new CredentialException(
                CredentialException.Reason.UPSTREAM_UNAVAILABLE, "token endpoint timeout"));

    assertThatThrownBy(() -> service.getValidAccessToken("user-1", Provider.TIKTOK))
        .isInstanceOf(CredentialException.class)
        .extracting(ex -> ((CredentialException) ex).reason())
        .isEqualTo(CredentialException.Reason.UPSTREAM_UNAVAILABLE);
    assertThat(stored.get()).isSameAs(original);
  }

  @Test
  void refreshWithoutExpiresInCarriesPreviousLifetimeForward() {
    // 前回更新 NOW-86400s、期限 NOW+200s なので寿命は 86600s
    givenStored(record(Provider.YOUTUBE, "access-1", "refresh-1", NOW.plusSeconds(200), false));
    when(tokenEndpointClient.refresh(Provider.YOUTUBE, YOUTUBE_SETTINGS, "refresh-1"))
        .thenReturn(new TokenGrant("access-2", null, "Bearer", null, null, null));

    final AccessToken token = service.getValidAccessToken("user-1", Provider.YOUTUBE);

    assertThat(token.value()).isEqualTo("access-2");
    assertThat(token.expiresAt()).isEqualTo(NOW.plusSeconds(86600));
    assertThat(stored.get().expiresAt()).isEqualTo(NOW.plusSeconds(86600));
    assertThat(stored.get().expiresWithin(Duration.ofSeconds(300), NOW)).isFalse();
  }

  @Test
  void refreshWithoutExpiresInAndUnknownLifetimeIsRetryable() {
    final CredentialRecord original =
        new CredentialRecord(
            "user-1",
            Provider.YOUTUBE,
            null,
            null,
            "access-1",
            "refresh-1",
            "Bearer",
            Set.of(),
            NOW.plusSeconds(60),
            false,
            null);
    givenStored(original);
    when(tokenEndpointClient.refresh(Provider.YOUTUBE, YOUTUBE_SETTINGS, "refresh-1"))
        .thenReturn(new TokenGrant("access-2", null, "Bearer", null, null, null));

    assertThatThrownBy(() -> service.getValidAccessToken("user-1", Provider.YOUTUBE))
        .isInstanceOf(CredentialException.class)
        .extracting(ex -> ((CredentialException) ex).reason())
        .isEqualTo(CredentialException.Reason.UPSTREAM_UNAVAILABLE);
    assertThat(stored.get()).isSameAs(original);
    verify(credentialRepository, never())
        .replaceTokens(any(), any(), any(), any(), any(), any(), any(), any());
  }

  @Test
  void expiringRecordWithoutRefreshTokenIsAuthExpired() {
    givenStored(record(Provider.YOUTUBE, "access-1", null, NOW.plusSeconds(60), false));

    assertThatThrownBy(() -> service.getValidAccessToken("user-1", Provider.YOUTUBE))
        .isInstanceOf(CredentialException.class)
        .extracting(ex -> ((CredentialException) ex).reason())
        .isEqualTo(CredentialException.Reason.AUTH_EXPIRED);
    verify(tokenEndpointClient, never()).refresh(any(), any(), anyString());
  }

  @Test
  void missingRecordIsNotConnected() {
    when(credentialRepository.find("user-1", Provider.TIKTOK)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.getValidAccessToken("user-1", Provider.TIKTOK))
        .isInstanceOf(CredentialException.class)
        .extracting(ex -> ((CredentialException) ex).reason())
        .isEqualTo(CredentialException.Reason.NOT_CONNECTED);
  }

  @Test
  void providerUserIdTakesPrecedenceOverOwnerKey() {
    final CredentialRecord byProviderId =
        new CredentialRecord(
            "user-9",
            Provider.TIKTOK,
            "open-1",
            null,
            "access-9",
            "refresh-9",
            "Bearer",
            Set.of(),
            NOW.plusSeconds(3600),
            true,
            NOW);
    when(credentialRepository.findByProviderUserId(Provider.TIKTOK, "open-1"))
        .thenReturn(Optional.of(byProviderId));

    final AccessToken token =
        service.getValidAccessToken(
            new OwnerIdentity("open-1", "user-1", "a@example.com"), Provider.TIKTOK);

    assertThat(token.value()).isEqualTo("access-9");
    verify(credentialRepository, never()).find(anyString(), any());
  }

  @Test
  void concurrentCallersShareOneRefresh() throws Exception {
    givenStored(record(Provider.TIKTOK, "access-1", "refresh-1", NOW.plusSeconds(200), true));
    final AtomicInteger invocations = new AtomicInteger();
    final CountDownLatch loaderEntered = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    when(tokenEndpointClient.refresh(Provider.TIKTOK, TIKTOK_SETTINGS, "refresh-1"))
        .thenAnswer(
            invocation -> {
              invocations.incrementAndGet();
              loaderEntered.countDown();
              release.await(5, TimeUnit.SECONDS);
              return new TokenGrant("access-2", "refresh-2", "Bearer", null, 86400L, null);
            });

    final int callers = 8;
    final ExecutorService executor = Executors.newFixedThreadPool(callers);
    try {
      final List<Future<AccessToken>> futures = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        futures.add(
            executor.submit(() -> service.getValidAccessToken("user-1", Provider.TIKTOK)));
      }
      assertThat(loaderEntered.await(5, TimeUnit.SECONDS)).isTrue();
      // 残りの呼び出しが進行中の更新に合流するのを待つ
      Thread.sleep(200);
      release.countDown();

      for (Future<AccessToken> future : futures) {
        assertThat(future.get(5, TimeUnit.SECONDS).value()).isEqualTo("access-2");
      }
    } finally {
      executor.shutdownNow();
    }
    // 旧 refresh token で 2 回目の更新を送ると回転型プロバイダでは失効する
    assertThat(invocations.get()).isEqualTo(1);
    verify(credentialRepository, times(1))
        .replaceTokens(any(), any(), any(), any(), any(), any(), any(), any());
  }

  @Test
  void connectStoresRecordWithProviderUserIdFromTokenResponse() {
    when(tokenEndpointClient.exchangeAuthorizationCode(
            Provider.TIKTOK, TIKTOK_SETTINGS, "code-1", "https://app.test/callback"))
        .thenReturn(
            new TokenGrant(
                "access-1", "refresh-1", "Bearer", Set.of("video.publish"), 86400L, "open-1"));

    final ConnectionSummary summary =
        service.connect(
            "user-1", Provider.TIKTOK, "code-1", "https://app.test/callback", null, null);

    final ArgumentCaptor<CredentialRecord> captor =
        ArgumentCaptor.forClass(CredentialRecord.class);
    verify(credentialRepository).upsert(captor.capture(), eq(NOW));
    assertThat(captor.getValue().providerUserId()).isEqualTo("open-1");
    assertThat(captor.getValue().rotatesRefreshToken()).isTrue();
    assertThat(captor.getValue().expiresAt()).isEqualTo(NOW.plusSeconds(86400));
    assertThat(summary.refreshable()).isTrue();
    assertThat(summary.scope()).containsExactly("video.publish");
  }

  @Test
  void disconnectWithoutRecordIsNotConnected() {
    when(credentialRepository.delete("user-1", Provider.YOUTUBE)).thenReturn(0);

    assertThatThrownBy(() -> service.disconnect("user-1", Provider.YOUTUBE))
        .isInstanceOf(CredentialException.class)
        .extracting(ex -> ((CredentialException) ex).reason())
        .isEqualTo(CredentialException.Reason.NOT_CONNECTED);
  }

  private void givenStored(CredentialRecord record) {
    stored.set(record);
    lenient()
        .when(credentialRepository.find("user-1", record.provider()))
        .thenAnswer(invocation -> Optional.ofNullable(stored.get()));
    lenient()
        .when(
            credentialRepository.replaceTokens(
                eq("user-1"), eq(record.provider()), any(), any(), any(), any(), any(), any()))
        .thenAnswer(
            invocation -> {
              final CredentialRecord current = stored.get();
              final String refreshToken = invocation.getArgument(3);
              final String tokenType = invocation.getArgument(4);
              final Set<String> scope = invocation.getArgument(5);
              stored.set(
                  new CredentialRecord(
                      current.ownerKey(),
                      current.provider(),
                      current.providerUserId(),
                      current.email(),
                      invocation.getArgument(2),
                      refreshToken != null ? refreshToken : current.refreshToken(),
                      tokenType != null ? tokenType : current.tokenType(),
                      scope != null ? scope : current.scope(),
                      invocation.getArgument(6),
                      current.rotatesRefreshToken(),
                      invocation.getArgument(7)));
              return 1;
            });
  }

  private CredentialRecord record(
      Provider provider,
      String accessToken,
      String refreshToken,
      Instant expiresAt,
      boolean rotates) {
    return new CredentialRecord(
        "user-1",
        provider,
        null,
        null,
        accessToken,
        refreshToken,
        "Bearer",
        Set.of(),
        expiresAt,
        rotates,
        NOW.minusSeconds(86400));
  }

  private double refreshCount(String provider, String result) {
    return meterRegistry
        .get("publisher.credential.refresh.total")
        .tag("provider", provider)
        .tag("result", result)
        .counter()
        .count();
  }
}
