/*
 * どこで: Publisher API
 * 何を: API キー口座の作成/一覧/失効エンドポイントを提供する
 * なぜ: 口座単位の残高と利用量を台帳から直接参照できるようにするため
 */
package com.example.publisher.api;

import com.example.publisher.api.response.AccountsResponse;
import com.example.publisher.service.CreditLedgerService;
import com.example.publisher.service.dto.AccountSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/accounts")
@RequiredArgsConstructor
public class AccountController {

  private static final String HEADER_USER_ID = "X-User-Id";

  private final CreditLedgerService ledgerService;

  @PostMapping
  public ResponseEntity<AccountSummary> create(@RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.status(HttpStatus.CREATED).body(ledgerService.createAccount(userId));
  }

  @GetMapping
  public ResponseEntity<AccountsResponse> list(@RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(new AccountsResponse(ledgerService.listAccounts(userId)));
  }

  @DeleteMapping("/{account_id}")
  public ResponseEntity<Void> revoke(
      @RequestHeader(HEADER_USER_ID) String userId,
      @PathVariable("account_id") String accountId) {
    ledgerService.revokeAccount(userId, accountId);
    return ResponseEntity.noContent().build();
  }
}
