/*
 * どこで: Publisher 設定
 * 何を: トークンエンドポイント/メディア取得/再ホスト用の RestClient をタイムアウト付きで提供する
 * なぜ: 外部呼び出しが無期限にスレッドを占有しないようにするため
 */
package com.example.publisher.config;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class HttpClientConfig {

  @Bean
  RestClient tokenEndpointRestClient(RestClient.Builder builder, CredentialProperties properties) {
    return builder
        .clone()
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  RestClient mediaDownloadRestClient(RestClient.Builder builder, MediaCacheProperties properties) {
    return builder
        .clone()
        .requestFactory(requestFactory(properties.connectTimeout(), properties.downloadTimeout()))
        .build();
  }

  @Bean
  RestClient mediaRehostRestClient(RestClient.Builder builder, MediaCacheProperties properties) {
    return builder
        .clone()
        .baseUrl(properties.rehostBaseUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.rehostTimeout()))
        .build();
  }

  private SimpleClientHttpRequestFactory requestFactory(Duration connect, Duration read) {
    final SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout((int) connect.toMillis());
    factory.setReadTimeout((int) read.toMillis());
    return factory;
  }
}
