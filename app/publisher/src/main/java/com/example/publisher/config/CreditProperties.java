/*
 * どこで: Publisher 設定
 * 何を: クレジット換算レートとモデル別価格表、初回アカウント付与量を保持する
 * なぜ: 価格改定をコード変更なしで反映できるようにするため
 */
package com.example.publisher.config;

import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "publisher.credit")
public record CreditProperties(
    Double creditsPerUsd,
    Map<String, Integer> modelPricing,
    String defaultModelTier,
    Long initialAccountGrant) {

  public CreditProperties {
    creditsPerUsd = creditsPerUsd == null ? 5.0d : creditsPerUsd;
    modelPricing =
        modelPricing == null || modelPricing.isEmpty()
            ? Map.of("sora-2", 1, "sora-2-pro", 3)
            : Map.copyOf(modelPricing);
    defaultModelTier =
        defaultModelTier == null || defaultModelTier.isBlank() ? "sora-2" : defaultModelTier;
    initialAccountGrant = initialAccountGrant == null ? 10L : initialAccountGrant;
  }
}
