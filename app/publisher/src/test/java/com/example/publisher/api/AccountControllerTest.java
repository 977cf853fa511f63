package com.example.publisher.api;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.publisher.model.AccountStatus;
import com.example.publisher.service.AccountNotFoundException;
import com.example.publisher.service.AccountOwnershipException;
import com.example.publisher.service.CreditLedgerService;
import com.example.publisher.service.dto.AccountSummary;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AccountController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
@ActiveProfiles("test")
class AccountControllerTest {

  private static final Instant CREATED_AT = Instant.parse("2026-03-01T00:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private CreditLedgerService ledgerService;

  @Test
  void createReturnsCreatedAccount() throws Exception {
    when(ledgerService.createAccount("user-1"))
        .thenReturn(new AccountSummary("key_a", 10L, 10L, 0L, AccountStatus.ACTIVE, CREATED_AT));

    mockMvc
        .perform(post("/v1/accounts").header("X-User-Id", "user-1"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.account_id").value("key_a"))
        .andExpect(jsonPath("$.initial_grant").value(10))
        .andExpect(jsonPath("$.status").value("ACTIVE"));
  }

  @Test
  void listReturnsAccountsWithUsage() throws Exception {
    when(ledgerService.listAccounts("user-1"))
        .thenReturn(
            List.of(
                new AccountSummary("key_a", 4L, 10L, 6L, AccountStatus.ACTIVE, CREATED_AT),
                new AccountSummary("key_b", 0L, 0L, 0L, AccountStatus.REVOKED, CREATED_AT)));

    mockMvc
        .perform(get("/v1/accounts").header("X-User-Id", "user-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.accounts[0].total_consumed").value(6))
        .andExpect(jsonPath("$.accounts[1].status").value("REVOKED"));
  }

  @Test
  void revokeReturnsNoContent() throws Exception {
    mockMvc
        .perform(delete("/v1/accounts/key_a").header("X-User-Id", "user-1"))
        .andExpect(status().isNoContent());
    verify(ledgerService).revokeAccount("user-1", "key_a");
  }

  @Test
  void revokeOfForeignAccountIsForbidden() throws Exception {
    doThrow(new AccountOwnershipException("account is not owned by caller"))
        .when(ledgerService)
        .revokeAccount("user-1", "key_b");

    mockMvc
        .perform(delete("/v1/accounts/key_b").header("X-User-Id", "user-1"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("ACCOUNT_FORBIDDEN"));
  }

  @Test
  void revokeOfUnknownAccountIsNotFound() throws Exception {
    doThrow(new AccountNotFoundException("key_x"))
        .when(ledgerService)
        .revokeAccount("user-1", "key_x");

    mockMvc
        .perform(delete("/v1/accounts/key_x").header("X-User-Id", "user-1"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("ACCOUNT_NOT_FOUND"));
  }
}
