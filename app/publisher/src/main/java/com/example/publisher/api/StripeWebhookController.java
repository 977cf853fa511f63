/*
 * どこで: Publisher API
 * 何を: Stripe webhook を生のボディと署名ヘッダのまま受け取る
 * なぜ: 署名検証は受信したバイト列そのものに対して行う必要があるため
 */
package com.example.publisher.api;

import com.example.publisher.api.response.WebhookAckResponse;
import com.example.publisher.model.ReconcileState;
import com.example.publisher.service.PaymentWebhookReconciler;
import com.example.publisher.service.dto.ReconcileOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StripeWebhookController {

  private static final String HEADER_STRIPE_SIGNATURE = "Stripe-Signature";

  private final PaymentWebhookReconciler reconciler;

  @PostMapping(
      path = "/v1/billing/stripe/webhook",
      consumes = MediaType.ALL_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<WebhookAckResponse> receive(
      @RequestHeader(value = HEADER_STRIPE_SIGNATURE, required = false) String signature,
      @RequestBody(required = false) String payload) {
    final ReconcileOutcome outcome = reconciler.reconcile(payload, signature);
    // マーカーは書けているので Stripe の再送は不要。付与は sweep が引き継ぐ
    final HttpStatus status =
        outcome.state() == ReconcileState.FAILED_RETRYABLE
                || outcome.state() == ReconcileState.MARKED_PROCESSING
            ? HttpStatus.ACCEPTED
            : HttpStatus.OK;
    return ResponseEntity.status(status).body(WebhookAckResponse.from(outcome));
  }
}
