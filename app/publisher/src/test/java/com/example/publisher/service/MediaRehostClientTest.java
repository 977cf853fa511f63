package com.example.publisher.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.publisher.config.MediaCacheProperties;
import com.example.publisher.model.MediaKind;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class MediaRehostClientTest {

  private static final String UPLOAD_URL = "http://media-store.test/api/v1/upload";

  @Test
  void uploadPostsMultipartAndReturnsUrl() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(UPLOAD_URL))
        .andExpect(method(POST))
        .andExpect(content().contentTypeCompatibleWith(MediaType.MULTIPART_FORM_DATA))
        .andExpect(content().string(containsString("media_abc.mp4")))
        .andRespond(
            withSuccess(
                "{\"url\":\"https://media.s3.amazonaws.com/media_abc.mp4\"}",
                MediaType.APPLICATION_JSON));

    final String url = fixture.client.upload(new byte[] {1, 2}, "media_abc.mp4", MediaKind.VIDEO);

    assertThat(url).isEqualTo("https://media.s3.amazonaws.com/media_abc.mp4");
    fixture.server.verify();
  }

  @Test
  void serverErrorIsRehostFailure() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(UPLOAD_URL)).andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.upload(new byte[] {1}, "f.mp4", MediaKind.VIDEO))
        .isInstanceOf(MediaException.class)
        .extracting(ex -> ((MediaException) ex).reason())
        .isEqualTo(MediaException.Reason.REHOST_FAILED);
  }

  @Test
  void responseWithoutUrlIsRehostFailure() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(UPLOAD_URL))
        .andRespond(withSuccess("{\"status\":\"ok\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.upload(new byte[] {1}, "f.mp4", MediaKind.VIDEO))
        .isInstanceOf(MediaException.class)
        .hasMessageContaining("no url");
  }

  private ClientFixture newFixture() {
    final MediaCacheProperties properties =
        new MediaCacheProperties(
            null, 0L, null, null, "http://media-store.test", null, null, null, 0L, null);
    final RestClient.Builder builder = RestClient.builder().baseUrl(properties.rehostBaseUrl());
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    return new ClientFixture(new MediaRehostClient(builder.build(), properties), server);
  }

  private record ClientFixture(MediaRehostClient client, MockRestServiceServer server) {}
}
