package com.example.publisher.service;

public class AccountNotFoundException extends RuntimeException {

  public AccountNotFoundException(String accountId) {
    super("account not found: " + accountId);
  }
}
