/*
 * どこで: Publisher サービス層
 * 何を: モデル別のクレジット価格と、支払額からのクレジット換算を提供する
 * なぜ: 価格表と換算規則(四捨五入/非有限値と負値の 0 クランプ)を 1 か所に集約するため
 */
package com.example.publisher.service;

import com.example.publisher.config.CreditProperties;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CreditPricing {

  private static final Logger logger = LoggerFactory.getLogger(CreditPricing.class);
  private static final int FALLBACK_COST = 1;
  private static final double MINOR_UNITS_PER_MAJOR = 100.0d;

  private final CreditProperties properties;
  private final PublisherMetrics metrics;

  /** 未知のモデルは既定モデルの価格で扱い、失敗させない。 */
  public int costOf(String modelTier) {
    if (modelTier != null) {
      final Integer cost = properties.modelPricing().get(modelTier.trim());
      if (cost != null) {
        return cost;
      }
    }
    return properties.modelPricing().getOrDefault(properties.defaultModelTier(), FALLBACK_COST);
  }

  /** 最小通貨単位(cent)の支払額をクレジットへ換算する。 */
  public long creditsForAmount(long currencyMinorUnits) {
    final double raw = currencyMinorUnits / MINOR_UNITS_PER_MAJOR * properties.creditsPerUsd();
    return clampCredits(raw, "amount_total=" + currencyMinorUnits);
  }

  /**
   * クレジット値を四捨五入し、非有限値と負値は 0 に丸める。
   *
   * <p>0 への丸めは異常値の検知対象なので WARN とメトリクスに残す。
   */
  public long clampCredits(double raw, String context) {
    if (!Double.isFinite(raw) || raw < 0) {
      metrics.recordClamp();
      logger.warn("credit value clamped to zero raw={} context={}", raw, context);
      return 0L;
    }
    return Math.round(raw);
  }

  /** 支払額が分からないときの総額推定(クレジット数から逆算した cent)。 */
  public long estimatedGrossMinorUnits(long credits) {
    if (properties.creditsPerUsd() <= 0) {
      return 0L;
    }
    return Math.round(credits / properties.creditsPerUsd() * MINOR_UNITS_PER_MAJOR);
  }

  public double creditsPerUsd() {
    return properties.creditsPerUsd();
  }

  public Map<String, Integer> pricingTable() {
    return new TreeMap<>(properties.modelPricing());
  }

  public String defaultModelTier() {
    return properties.defaultModelTier();
  }
}
