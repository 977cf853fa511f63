/*
 * どこで: Publisher 設定バインドのテスト
 * 何を: Duration/Map/enum キーの設定値が起動時に正しく解釈されることを検証する
 * なぜ: プロバイダ trait と価格表の設定ミスを起動時点で検出するため
 */
package com.example.publisher.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.publisher.model.Provider;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class PublisherPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "publisher.credential.refresh-threshold=5m",
              "publisher.credential.providers.tiktok.token-endpoint=http://tokens.test/tiktok",
              "publisher.credential.providers.tiktok.client-id=ck",
              "publisher.credential.providers.tiktok.client-id-param=client_key",
              "publisher.credential.providers.tiktok.rotates-refresh-token=true",
              "publisher.credit.credits-per-usd=4",
              "publisher.credit.model-pricing.sora-2=2",
              "publisher.credit.model-pricing.sora-2-pro=6",
              "publisher.billing.grant-sweep.poll-interval=10s",
              "publisher.billing.grant-sweep.lease=60s",
              "publisher.media.max-download-bytes=1024",
              "publisher.media.cache-ttl=2h");

  @Test
  void contextStartsAndBindsPublisherProperties() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final CredentialProperties credential = context.getBean(CredentialProperties.class);
          final CreditProperties credit = context.getBean(CreditProperties.class);
          final CreditGrantSweepProperties sweep =
              context.getBean(CreditGrantSweepProperties.class);
          final MediaCacheProperties media = context.getBean(MediaCacheProperties.class);

          assertThat(credential.refreshThreshold()).isEqualTo(Duration.ofMinutes(5));
          final CredentialProperties.ProviderSettings tiktok =
              credential.settingsFor(Provider.TIKTOK);
          assertThat(tiktok.clientIdParam()).isEqualTo("client_key");
          assertThat(tiktok.rotatesRefreshToken()).isTrue();
          assertThat(tiktok.expiryField()).isEqualTo("expires_in");

          assertThat(credit.creditsPerUsd()).isEqualTo(4.0d);
          assertThat(credit.modelPricing()).containsEntry("sora-2-pro", 6);
          assertThat(credit.defaultModelTier()).isEqualTo("sora-2");
          assertThat(credit.initialAccountGrant()).isEqualTo(10L);

          assertThat(sweep.pollInterval()).isEqualTo(Duration.ofSeconds(10));
          assertThat(sweep.lease()).isEqualTo(Duration.ofSeconds(60));

          assertThat(media.maxDownloadBytes()).isEqualTo(1024L);
          assertThat(media.cacheTtl()).isEqualTo(Duration.ofHours(2));
          assertThat(media.canonicalHosts()).containsExactly("amazonaws.com");
        });
  }

  @Configuration
  @EnableConfigurationProperties({
    CredentialProperties.class,
    CreditProperties.class,
    CreditGrantSweepProperties.class,
    MediaCacheProperties.class
  })
  static class TestConfiguration {}
}
