/*
 * どこで: Publisher API
 * 何を: クレジット消費/残高/価格表のエンドポイントを提供する
 * なぜ: 有料操作の前にアダプタが同じ台帳から引き落とせるようにするため
 */
package com.example.publisher.api;

import com.example.publisher.api.request.ConsumeCreditsRequest;
import com.example.publisher.api.response.BalanceResponse;
import com.example.publisher.api.response.ConsumeCreditsResponse;
import com.example.publisher.api.response.PricingResponse;
import com.example.publisher.service.CreditLedgerService;
import com.example.publisher.service.CreditPricing;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/credits")
@RequiredArgsConstructor
public class CreditController {

  private static final String HEADER_USER_ID = "X-User-Id";

  private final CreditLedgerService ledgerService;
  private final CreditPricing pricing;

  @PostMapping("/consume")
  public ResponseEntity<ConsumeCreditsResponse> consume(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody ConsumeCreditsRequest request) {
    final long amount =
        request.amount() != null ? request.amount() : pricing.costOf(request.model());
    return ResponseEntity.ok(
        ConsumeCreditsResponse.from(ledgerService.consume(userId, amount, request.accountId())));
  }

  @GetMapping("/balance")
  public ResponseEntity<BalanceResponse> balance(@RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(new BalanceResponse(ledgerService.balance(userId)));
  }

  @GetMapping("/pricing")
  public ResponseEntity<PricingResponse> pricing() {
    final double creditsPerUsd = pricing.creditsPerUsd();
    final List<PricingResponse.ModelPrice> models =
        pricing.pricingTable().entrySet().stream()
            .map(
                entry ->
                    new PricingResponse.ModelPrice(
                        entry.getKey(),
                        entry.getValue(),
                        creditsPerUsd > 0 ? entry.getValue() / creditsPerUsd : 0.0d))
            .toList();
    return ResponseEntity.ok(
        new PricingResponse(creditsPerUsd, pricing.defaultModelTier(), models));
  }
}
