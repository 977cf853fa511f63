/*
 * どこで: Publisher メディア層
 * 何を: 外部 URL からメディアをサイズ上限と総時間上限付きでダウンロードする
 * なぜ: 巨大/低速な転送でメモリとスレッドを占有させないため
 */
package com.example.publisher.service;

import com.example.publisher.config.MediaCacheProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Service
public class MediaDownloadClient {

  private static final Logger logger = LoggerFactory.getLogger(MediaDownloadClient.class);
  private static final int BUFFER_SIZE = 64 * 1024;

  private final RestClient mediaDownloadRestClient;
  private final MediaCacheProperties properties;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public MediaDownloadClient(
      RestClient mediaDownloadRestClient, MediaCacheProperties properties, Clock clock) {
    this.mediaDownloadRestClient = mediaDownloadRestClient;
    this.properties = properties;
    this.clock = clock;
  }

  public byte[] download(URI source) {
    final Instant deadline = Instant.now(clock).plus(properties.downloadTimeout());
    final long maxBytes = properties.maxDownloadBytes();
    try {
      return mediaDownloadRestClient
          .get()
          .uri(source)
          .exchange(
              (request, response) -> {
                if (!response.getStatusCode().is2xxSuccessful()) {
                  logger.warn(
                      "media download rejected source={} status={}",
                      source,
                      response.getStatusCode().value());
                  throw new MediaException(
                      MediaException.Reason.DOWNLOAD_FAILED,
                      "media download returned status " + response.getStatusCode().value());
                }
                final long declared = response.getHeaders().getContentLength();
                if (declared > maxBytes) {
                  throw tooLarge(source, declared, maxBytes);
                }
                return readBounded(source, response.getBody(), maxBytes, deadline);
              });
    } catch (ResourceAccessException ex) {
      logger.warn("media download I/O failure source={}", source, ex);
      throw new MediaException(
          MediaException.Reason.DOWNLOAD_FAILED, "media download failed: " + ex.getMessage(), ex);
    } catch (RestClientException ex) {
      logger.warn("media download failure source={}", source, ex);
      throw new MediaException(
          MediaException.Reason.DOWNLOAD_FAILED, "media download failed: " + ex.getMessage(), ex);
    }
  }

  private byte[] readBounded(URI source, InputStream body, long maxBytes, Instant deadline)
      throws IOException {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    final byte[] buffer = new byte[BUFFER_SIZE];
    long total = 0;
    int read;
    while ((read = body.read(buffer)) != -1) {
      total += read;
      // Content-Length を送らない/偽るサーバーがあるため実測でも確認する
      if (total > maxBytes) {
        throw tooLarge(source, total, maxBytes);
      }
      if (Instant.now(clock).isAfter(deadline)) {
        logger.warn("media download exceeded deadline source={} readBytes={}", source, total);
        throw new MediaException(
            MediaException.Reason.DOWNLOAD_FAILED, "media download exceeded time limit");
      }
      out.write(buffer, 0, read);
    }
    if (total == 0) {
      throw new MediaException(MediaException.Reason.DOWNLOAD_FAILED, "media body is empty");
    }
    return out.toByteArray();
  }

  private MediaException tooLarge(URI source, long size, long maxBytes) {
    logger.warn("media download too large source={} size={} limit={}", source, size, maxBytes);
    return new MediaException(
        MediaException.Reason.DOWNLOAD_FAILED,
        "media exceeds size limit of " + maxBytes + " bytes");
  }
}
