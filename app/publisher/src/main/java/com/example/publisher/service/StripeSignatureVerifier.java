/*
 * どこで: Publisher サービス層
 * 何を: Stripe-Signature ヘッダを webhook 秘密鍵で検証する
 * なぜ: 改ざん/なりすましイベントで状態を一切変えないため
 */
package com.example.publisher.service;

import com.example.publisher.config.StripeWebhookProperties;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.net.Webhook;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class StripeSignatureVerifier {

  private static final Logger logger = LoggerFactory.getLogger(StripeSignatureVerifier.class);

  private final StripeWebhookProperties properties;

  public void verify(String payload, String signatureHeader) {
    if (payload == null || payload.isEmpty()) {
      throw new WebhookSignatureException("webhook payload is empty");
    }
    if (signatureHeader == null || signatureHeader.isBlank()) {
      logger.warn("stripe webhook rejected: signature header missing");
      throw new WebhookSignatureException("Stripe-Signature header is required");
    }
    try {
      Webhook.Signature.verifyHeader(
          payload,
          signatureHeader,
          properties.webhookSecret(),
          properties.signatureTolerance().toSeconds());
    } catch (SignatureVerificationException ex) {
      logger.warn("stripe webhook signature verification failed: {}", ex.getMessage());
      throw new WebhookSignatureException("invalid Stripe signature", ex);
    }
  }
}
