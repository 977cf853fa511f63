/*
 * どこで: Publisher 設定
 * 何を: Stripe webhook 署名検証の秘密鍵と許容時刻差、クレジット商品種別を保持する
 * なぜ: 秘密鍵未設定のまま起動してリクエスト単位で失敗する状態を作らないため
 */
package com.example.publisher.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "publisher.billing.stripe")
public record StripeWebhookProperties(
    @NotBlank(message = "publisher.billing.stripe.webhook-secret is required")
        String webhookSecret,
    Duration signatureTolerance,
    String creditProductType) {

  public StripeWebhookProperties {
    signatureTolerance =
        signatureTolerance == null ? Duration.ofMinutes(5) : signatureTolerance;
    creditProductType =
        creditProductType == null || creditProductType.isBlank()
            ? "sora-api-credits"
            : creditProductType;
  }
}
