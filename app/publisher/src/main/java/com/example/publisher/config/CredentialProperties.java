/*
 * どこで: Publisher 設定
 * 何を: OAuth 資格情報の更新閾値とプロバイダ別トークンエンドポイント設定を保持する
 * なぜ: プロバイダ差分を設定値(trait)に閉じ込め、更新ロジックを 1 つにまとめるため
 */
package com.example.publisher.config;

import com.example.publisher.model.Provider;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "publisher.credential")
public record CredentialProperties(
    Duration refreshThreshold,
    Duration connectTimeout,
    Duration readTimeout,
    Map<Provider, ProviderSettings> providers) {

  public CredentialProperties {
    refreshThreshold = refreshThreshold == null ? Duration.ofSeconds(300) : refreshThreshold;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
    providers = providers == null ? Map.of() : Map.copyOf(providers);
  }

  public ProviderSettings settingsFor(Provider provider) {
    final ProviderSettings settings = providers.get(provider);
    if (settings == null) {
      throw new IllegalStateException("provider is not configured: " + provider);
    }
    return settings;
  }

  /**
   * プロバイダごとの trait。
   *
   * @param clientIdParam client id を送るフォーム項目名(TikTok は client_key)
   * @param rotatesRefreshToken 更新のたびに refresh token が差し替わるか
   * @param expiryField 有効期限(秒)が入るレスポンス項目名
   * @param providerUserIdField プロバイダ側ユーザー ID が入るレスポンス項目名(無ければ null)
   */
  public record ProviderSettings(
      String tokenEndpoint,
      String clientId,
      String clientSecret,
      String clientIdParam,
      boolean rotatesRefreshToken,
      String expiryField,
      String providerUserIdField) {

    public ProviderSettings {
      clientIdParam = clientIdParam == null || clientIdParam.isBlank() ? "client_id" : clientIdParam;
      expiryField = expiryField == null || expiryField.isBlank() ? "expires_in" : expiryField;
      clientSecret = clientSecret == null ? "" : clientSecret;
    }
  }
}
