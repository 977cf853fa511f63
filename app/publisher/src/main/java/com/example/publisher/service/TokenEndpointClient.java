/*
 * どこで: Publisher サービス層
 * 何を: プロバイダの OAuth トークンエンドポイントへ refresh / 認可コード交換を送る
 * なぜ: プロバイダごとに重複していた更新処理を trait 設定付きの 1 クライアントにまとめるため
 */
package com.example.publisher.service;

import com.example.publisher.config.CredentialProperties.ProviderSettings;
import com.example.publisher.model.Provider;
import com.example.publisher.service.dto.TokenGrant;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Service
public class TokenEndpointClient {

  private static final Logger logger = LoggerFactory.getLogger(TokenEndpointClient.class);
  private static final Set<String> TERMINAL_ERROR_CODES =
      Set.of("invalid_grant", "invalid_client", "unauthorized_client", "access_denied");

  private final RestClient tokenEndpointRestClient;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public TokenEndpointClient(RestClient tokenEndpointRestClient) {
    this.tokenEndpointRestClient = tokenEndpointRestClient;
  }

  public TokenGrant refresh(Provider provider, ProviderSettings settings, String refreshToken) {
    final MultiValueMap<String, String> form = baseForm(settings);
    form.add("grant_type", "refresh_token");
    form.add("refresh_token", refreshToken);
    return post(provider, settings, form, "refresh");
  }

  public TokenGrant exchangeAuthorizationCode(
      Provider provider, ProviderSettings settings, String code, String redirectUri) {
    final MultiValueMap<String, String> form = baseForm(settings);
    form.add("grant_type", "authorization_code");
    form.add("code", code);
    if (redirectUri != null && !redirectUri.isBlank()) {
      form.add("redirect_uri", redirectUri);
    }
    return post(provider, settings, form, "authorization_code");
  }

  private MultiValueMap<String, String> baseForm(ProviderSettings settings) {
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add(settings.clientIdParam(), settings.clientId());
    form.add("client_secret", settings.clientSecret());
    return form;
  }

  private TokenGrant post(
      Provider provider,
      ProviderSettings settings,
      MultiValueMap<String, String> form,
      String operation) {
    final JsonNode body;
    try {
      body =
          tokenEndpointRestClient
              .post()
              .uri(settings.tokenEndpoint())
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .accept(MediaType.APPLICATION_JSON)
              .body(form)
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(provider, operation, ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(provider, operation, ex);
    } catch (RestClientException ex) {
      logger.warn("token endpoint response parse failed provider={} op={}", provider, operation, ex);
      throw new CredentialException(
          CredentialException.Reason.UPSTREAM_UNAVAILABLE,
          "token endpoint response is invalid",
          ex);
    }
    return toGrant(provider, settings, operation, body);
  }

  private TokenGrant toGrant(
      Provider provider, ProviderSettings settings, String operation, JsonNode body) {
    if (body == null || body.isNull()) {
      throw new CredentialException(
          CredentialException.Reason.UPSTREAM_UNAVAILABLE, "token endpoint returned empty body");
    }
    final String accessToken = text(body, "access_token");
    if (accessToken == null) {
      // 200 応答のまま error を返すプロバイダがある
      final String error = text(body, "error");
      logger.warn(
          "token endpoint returned no access_token provider={} op={} error={}",
          provider,
          operation,
          error);
      if (error != null && TERMINAL_ERROR_CODES.contains(error)) {
        return throwAuthExpired(provider, error);
      }
      throw new CredentialException(
          CredentialException.Reason.UPSTREAM_UNAVAILABLE, "token endpoint response is invalid");
    }
    return new TokenGrant(
        accessToken,
        text(body, "refresh_token"),
        text(body, "token_type"),
        parseScope(text(body, "scope")),
        parseSeconds(body.get(settings.expiryField())),
        settings.providerUserIdField() == null
            ? null
            : text(body, settings.providerUserIdField()));
  }

  private TokenGrant throwAuthExpired(Provider provider, String error) {
    throw new CredentialException(
        CredentialException.Reason.AUTH_EXPIRED,
        "authorization rejected by " + provider + ": " + error);
  }

  private CredentialException mapResponseException(
      Provider provider, String operation, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "token endpoint {} failed provider={} status={} statusText={}",
        operation,
        provider,
        status,
        ex.getStatusText());
    // 400/401/403 は invalid_grant 等の恒久的な拒否として扱う
    if (status == 400 || status == 401 || status == 403) {
      return new CredentialException(
          CredentialException.Reason.AUTH_EXPIRED,
          "authorization rejected by " + provider,
          ex);
    }
    return new CredentialException(
        CredentialException.Reason.UPSTREAM_UNAVAILABLE,
        "token endpoint unavailable for " + provider,
        ex);
  }

  private CredentialException mapResourceException(
      Provider provider, String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("token endpoint {} timed out provider={}", operation, provider);
      return new CredentialException(
          CredentialException.Reason.UPSTREAM_UNAVAILABLE,
          "token endpoint timeout for " + provider,
          ex);
    }
    logger.warn("token endpoint {} connection failed provider={}", operation, provider, ex);
    return new CredentialException(
        CredentialException.Reason.UPSTREAM_UNAVAILABLE,
        "token endpoint connection failed for " + provider,
        ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private static String text(JsonNode body, String field) {
    final JsonNode node = body.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    final String value = node.asText();
    return value.isBlank() ? null : value;
  }

  private static Long parseSeconds(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.canConvertToLong()) {
      return node.asLong();
    }
    try {
      return Long.parseLong(node.asText().trim());
    } catch (NumberFormatException ex) {
      logger.warn("token endpoint returned non-numeric expiry value={}", node.asText());
      return null;
    }
  }

  private static Set<String> parseScope(String scope) {
    if (scope == null) {
      return null;
    }
    return Arrays.stream(scope.trim().split("[\\s,]+"))
        .filter(value -> !value.isBlank())
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }
}
