/*
 * どこで: Publisher サービス層
 * 何を: API キー口座とウォレットの 2 スコープでクレジットを消費/付与する
 * なぜ: 残高を負にせず、部分的な引き落としも起こさずに課金を確定させるため
 */
package com.example.publisher.service;

import com.example.common.lock.AdvisoryLockKeys;
import com.example.publisher.config.CreditProperties;
import com.example.publisher.model.ApiKeyAccount;
import com.example.publisher.model.ConsumeReceipt;
import com.example.publisher.model.CreditDestination;
import com.example.publisher.model.CreditSource;
import com.example.publisher.model.UserWallet;
import com.example.publisher.repository.AdvisoryLockRepository;
import com.example.publisher.repository.ApiKeyAccountRepository;
import com.example.publisher.repository.UserWalletRepository;
import com.example.publisher.service.dto.AccountSummary;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class CreditLedgerService {

  private static final Logger logger = LoggerFactory.getLogger(CreditLedgerService.class);
  private static final String ACCOUNT_CREATE_LOCK_NAMESPACE = "account-create";
  private static final String ACCOUNT_ID_PREFIX = "key_";
  private static final long MINIMUM_DEBIT = 1L;

  private final ApiKeyAccountRepository accountRepository;
  private final UserWalletRepository walletRepository;
  private final AdvisoryLockRepository advisoryLockRepository;
  private final CreditProperties properties;
  private final PublisherMetrics metrics;
  private final Clock clock;

  /**
   * 役割:
   * - 指定口座(任意)→ウォレットの順で amount を引き落とす。
   *
   * 期待動作:
   * - 口座が残高不足なら口座からは一切引かずにウォレットを試す。
   * - どちらも不足なら InsufficientCreditsException とし、残高は変えない。
   * - 他人の口座/失効口座の指定は AccountOwnershipException とする。
   */
  public ConsumeReceipt consume(String ownerKey, Long amount, String preferredAccountId) {
    requireOwnerKey(ownerKey);
    final long debit = Math.max(MINIMUM_DEBIT, amount == null ? MINIMUM_DEBIT : amount);
    if (preferredAccountId != null && !preferredAccountId.isBlank()) {
      final ApiKeyAccount account = requireUsableAccount(ownerKey, preferredAccountId);
      // 条件付き UPDATE なので同時消費でも残高を超えて引かれない
      final OptionalLong remaining =
          accountRepository.decrementIfSufficient(account.accountId(), debit);
      if (remaining.isPresent()) {
        metrics.recordConsume("account");
        return new ConsumeReceipt(
            CreditSource.ACCOUNT, remaining.getAsLong(), account.accountId(), debit);
      }
      logger.debug(
          "account balance insufficient, falling through to wallet ownerKey={} accountId={}",
          ownerKey,
          account.accountId());
    }
    final OptionalLong walletRemaining =
        walletRepository.decrementIfSufficient(ownerKey, debit, Instant.now(clock));
    if (walletRemaining.isPresent()) {
      metrics.recordConsume("wallet");
      return new ConsumeReceipt(CreditSource.WALLET, walletRemaining.getAsLong(), null, debit);
    }
    metrics.recordConsume("insufficient");
    logger.info(
        "credit consume rejected: insufficient ownerKey={} accountId={} amount={}",
        ownerKey,
        preferredAccountId,
        debit);
    throw new InsufficientCreditsException(debit);
  }

  /** 無条件の加算。webhook 照合と口座作成ボーナスから使う。 */
  @Transactional
  public void grant(String ownerKey, long amount, CreditDestination destination) {
    requireOwnerKey(ownerKey);
    if (amount < 0) {
      throw new IllegalArgumentException("grant amount must not be negative");
    }
    if (amount == 0) {
      logger.warn(
          "credit grant skipped because amount is zero ownerKey={} destination={}",
          ownerKey,
          destination.label());
      return;
    }
    if (destination.source() == CreditSource.ACCOUNT) {
      final int updated = accountRepository.increment(destination.accountId(), ownerKey, amount);
      if (updated == 0) {
        throw new AccountNotFoundException(destination.accountId());
      }
    } else {
      walletRepository.increment(ownerKey, amount, Instant.now(clock));
    }
    logger.info(
        "credits granted ownerKey={} destination={} amount={}",
        ownerKey,
        destination.label(),
        amount);
  }

  /** 最新の有効口座(作成日時、同時刻は account_id 降順)、無ければウォレット。 */
  public CreditDestination resolveGrantDestination(String ownerKey) {
    return accountRepository
        .findNewestActive(ownerKey)
        .map(account -> CreditDestination.account(account.accountId()))
        .orElseGet(CreditDestination::wallet);
  }

  public long balance(String ownerKey) {
    requireOwnerKey(ownerKey);
    final long accounts = accountRepository.sumBalanceByOwner(ownerKey);
    final long wallet = walletRepository.find(ownerKey).map(UserWallet::balance).orElse(0L);
    return accounts + wallet;
  }

  public UserWallet wallet(String ownerKey) {
    requireOwnerKey(ownerKey);
    return walletRepository.find(ownerKey).orElseGet(() -> UserWallet.empty(ownerKey));
  }

  /** オーナーの最初の口座だけに初回付与を行う。 */
  @Transactional
  public AccountSummary createAccount(String ownerKey) {
    requireOwnerKey(ownerKey);
    // 同時作成で 2 口座とも初回扱いにならないようオーナー単位で直列化する
    advisoryLockRepository.lock(AdvisoryLockKeys.of(ACCOUNT_CREATE_LOCK_NAMESPACE, ownerKey));
    final boolean first = accountRepository.countByOwner(ownerKey) == 0;
    final long initialGrant = first ? properties.initialAccountGrant() : 0L;
    final String accountId = ACCOUNT_ID_PREFIX + UUID.randomUUID().toString().replace("-", "");
    accountRepository.insert(accountId, ownerKey, initialGrant, Instant.now(clock));
    logger.info(
        "api key account created ownerKey={} accountId={} initialGrant={}",
        ownerKey,
        accountId,
        initialGrant);
    return accountRepository
        .findById(accountId)
        .map(AccountSummary::from)
        .orElseThrow(() -> new IllegalStateException("created account not found: " + accountId));
  }

  public List<AccountSummary> listAccounts(String ownerKey) {
    requireOwnerKey(ownerKey);
    return accountRepository.findByOwner(ownerKey).stream().map(AccountSummary::from).toList();
  }

  public void revokeAccount(String ownerKey, String accountId) {
    requireOwnerKey(ownerKey);
    final ApiKeyAccount account =
        accountRepository
            .findById(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    if (!account.ownerKey().equals(ownerKey)) {
      logAbuse(ownerKey, accountId, "revoke");
      throw new AccountOwnershipException("account is not owned by caller");
    }
    final int updated = accountRepository.revoke(accountId, ownerKey, Instant.now(clock));
    if (updated == 0) {
      logger.info("api key account already revoked ownerKey={} accountId={}", ownerKey, accountId);
      return;
    }
    logger.info("api key account revoked ownerKey={} accountId={}", ownerKey, accountId);
  }

  private ApiKeyAccount requireUsableAccount(String ownerKey, String accountId) {
    final ApiKeyAccount account = accountRepository.findById(accountId).orElse(null);
    if (account == null || !account.ownerKey().equals(ownerKey)) {
      // 存在しない口座も所有者不一致と同じ応答にし、口座 ID の探索を防ぐ
      logAbuse(ownerKey, accountId, "consume");
      metrics.recordConsume("unauthorized");
      throw new AccountOwnershipException("account is not owned by caller");
    }
    if (!account.isActive()) {
      metrics.recordConsume("unauthorized");
      logger.warn(
          "credit consume rejected: account revoked ownerKey={} accountId={}",
          ownerKey,
          accountId);
      throw new AccountOwnershipException("account is revoked");
    }
    return account;
  }

  private void logAbuse(String ownerKey, String accountId, String operation) {
    logger.warn(
        "account ownership mismatch, potential abuse op={} ownerKey={} accountId={}",
        operation,
        ownerKey,
        accountId);
  }

  private static void requireOwnerKey(String ownerKey) {
    if (ownerKey == null || ownerKey.isBlank()) {
      throw new IllegalArgumentException("ownerKey is required");
    }
  }
}
