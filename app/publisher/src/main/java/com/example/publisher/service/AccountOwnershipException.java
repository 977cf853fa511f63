package com.example.publisher.service;

/** 指定アカウントが呼び出し元の所有でない、または失効済みのときに投げる。 */
public class AccountOwnershipException extends RuntimeException {

  public AccountOwnershipException(String message) {
    super(message);
  }
}
