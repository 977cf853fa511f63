package com.example.publisher.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CreditSource {
  ACCOUNT,
  WALLET;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
