package com.example.publisher.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.publisher.config.CredentialProperties.ProviderSettings;
import com.example.publisher.model.Provider;
import com.example.publisher.service.dto.TokenGrant;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class TokenEndpointClientTest {

  private static final ProviderSettings TIKTOK =
      new ProviderSettings(
          "http://tokens.test/tiktok", "ck", "cs", "client_key", true, "expires_in", "open_id");
  private static final ProviderSettings LINKEDIN =
      new ProviderSettings("http://tokens.test/linkedin", "lc", "ls", null, false, null, null);

  @Test
  void refreshSendsProviderSpecificClientIdParameter() {
    final ClientFixture fixture = newFixture();
    final MultiValueMap<String, String> expectedForm = new LinkedMultiValueMap<>();
    expectedForm.add("client_key", "ck");
    expectedForm.add("client_secret", "cs");
    expectedForm.add("grant_type", "refresh_token");
    expectedForm.add("refresh_token", "refresh-1");
    fixture
        .server
        .expect(requestTo("http://tokens.test/tiktok"))
        .andExpect(method(POST))
        .andExpect(content().formData(expectedForm))
        .andRespond(
            withSuccess(
                """
                {"access_token":"access-2","refresh_token":"refresh-2","token_type":"Bearer",
                 "expires_in":86400,"scope":"user.info.basic,video.publish","open_id":"open-1"}
                """,
                MediaType.APPLICATION_JSON));

    final TokenGrant grant = fixture.client.refresh(Provider.TIKTOK, TIKTOK, "refresh-1");

    assertThat(grant.accessToken()).isEqualTo("access-2");
    assertThat(grant.refreshToken()).isEqualTo("refresh-2");
    assertThat(grant.expiresInSeconds()).isEqualTo(86400L);
    assertThat(grant.scope()).containsExactly("user.info.basic", "video.publish");
    assertThat(grant.providerUserId()).isEqualTo("open-1");
  }

  @Test
  void refreshAcceptsResponseWithoutRefreshTokenOrExpiry() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://tokens.test/linkedin"))
        .andRespond(withSuccess("{\"access_token\":\"access-2\"}", MediaType.APPLICATION_JSON));

    final TokenGrant grant = fixture.client.refresh(Provider.LINKEDIN, LINKEDIN, "refresh-1");

    assertThat(grant.hasRefreshToken()).isFalse();
    assertThat(grant.expiresInSeconds()).isNull();
    assertThat(grant.scope()).isNull();
  }

  @Test
  void invalidGrantStatusMapsToAuthExpired() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://tokens.test/tiktok"))
        .andRespond(
            withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":\"invalid_grant\"}"));

    assertThatThrownBy(() -> fixture.client.refresh(Provider.TIKTOK, TIKTOK, "refresh-1"))
        .isInstanceOf(CredentialException.class)
        .extracting(ex -> ((CredentialException) ex).reason())
        .isEqualTo(CredentialException.Reason.AUTH_EXPIRED);
  }

  @Test
  void errorInsideSuccessfulResponseMapsToAuthExpired() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://tokens.test/tiktok"))
        .andRespond(
            withSuccess(
                "{\"error\":\"invalid_grant\",\"error_description\":\"expired\"}",
                MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.refresh(Provider.TIKTOK, TIKTOK, "refresh-1"))
        .isInstanceOf(CredentialException.class)
        .extracting(ex -> ((CredentialException) ex).reason())
        .isEqualTo(CredentialException.Reason.AUTH_EXPIRED);
  }

  @Test
  void serverErrorMapsToUpstreamUnavailable() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo("http://tokens.test/tiktok")).andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.refresh(Provider.TIKTOK, TIKTOK, "refresh-1"))
        .isInstanceOf(CredentialException.class)
        .extracting(ex -> ((CredentialException) ex).reason())
        .isEqualTo(CredentialException.Reason.UPSTREAM_UNAVAILABLE);
  }

  @Test
  void timeoutMapsToUpstreamUnavailable() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://tokens.test/tiktok"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.client.refresh(Provider.TIKTOK, TIKTOK, "refresh-1"))
        .isInstanceOf(CredentialException.class)
        .extracting(ex -> ((CredentialException) ex).reason())
        .isEqualTo(CredentialException.Reason.UPSTREAM_UNAVAILABLE);
  }

  @Test
  void exchangeAuthorizationCodeSendsRedirectUri() {
    final ClientFixture fixture = newFixture();
    final MultiValueMap<String, String> expectedForm = new LinkedMultiValueMap<>();
    expectedForm.add("client_id", "lc");
    expectedForm.add("client_secret", "ls");
    expectedForm.add("grant_type", "authorization_code");
    expectedForm.add("code", "code-1");
    expectedForm.add("redirect_uri", "https://app.test/callback");
    fixture
        .server
        .expect(requestTo("http://tokens.test/linkedin"))
        .andExpect(content().formData(expectedForm))
        .andRespond(
            withSuccess(
                "{\"access_token\":\"access-1\",\"expires_in\":\"5183999\"}",
                MediaType.APPLICATION_JSON));

    final TokenGrant grant =
        fixture.client.exchangeAuthorizationCode(
            Provider.LINKEDIN, LINKEDIN, "code-1", "https://app.test/callback");

    assertThat(grant.accessToken()).isEqualTo("access-1");
    assertThat(grant.expiresInSeconds()).isEqualTo(5183999L);
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    return new ClientFixture(new TokenEndpointClient(builder.build()), server);
  }

  private record ClientFixture(TokenEndpointClient client, MockRestServiceServer server) {}
}
