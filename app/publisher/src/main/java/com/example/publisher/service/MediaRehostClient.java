/*
 * どこで: Publisher メディア層
 * 何を: メディアのバイト列を正規ストレージへアップロードし、公開 URL を受け取る
 * なぜ: 全プロバイダが同じ URL を参照できるようにするため
 */
package com.example.publisher.service;

import com.example.publisher.config.MediaCacheProperties;
import com.example.publisher.model.MediaKind;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Service
public class MediaRehostClient {

  private static final Logger logger = LoggerFactory.getLogger(MediaRehostClient.class);

  private final RestClient mediaRehostRestClient;
  private final MediaCacheProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public MediaRehostClient(RestClient mediaRehostRestClient, MediaCacheProperties properties) {
    this.mediaRehostRestClient = mediaRehostRestClient;
    this.properties = properties;
  }

  public String upload(byte[] content, String filename, MediaKind kind) {
    final MultipartBodyBuilder multipart = new MultipartBodyBuilder();
    multipart
        .part("file", new ByteArrayResource(content))
        .filename(filename)
        .contentType(MediaType.parseMediaType(kind.contentType()));
    multipart.part("platform", properties.rehostPlatform());
    final JsonNode body;
    try {
      body =
          mediaRehostRestClient
              .post()
              .uri(properties.rehostUploadPath())
              .contentType(MediaType.MULTIPART_FORM_DATA)
              .accept(MediaType.APPLICATION_JSON)
              .body(multipart.build())
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "media rehost failed filename={} status={}", filename, ex.getStatusCode().value());
      throw new MediaException(
          MediaException.Reason.REHOST_FAILED,
          "media store returned status " + ex.getStatusCode().value(),
          ex);
    } catch (RestClientException ex) {
      logger.warn("media rehost failed filename={}", filename, ex);
      throw new MediaException(
          MediaException.Reason.REHOST_FAILED, "media store is unavailable", ex);
    }
    final JsonNode url = body == null ? null : body.get("url");
    if (url == null || !url.isTextual() || url.asText().isBlank()) {
      logger.warn("media rehost returned no url filename={}", filename);
      throw new MediaException(MediaException.Reason.REHOST_FAILED, "media store returned no url");
    }
    return url.asText();
  }
}
