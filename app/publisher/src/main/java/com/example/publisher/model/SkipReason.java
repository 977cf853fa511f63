package com.example.publisher.model;

public enum SkipReason {
  ALREADY_PROCESSED,
  UNSUPPORTED_EVENT_TYPE,
  NOT_PAID,
  NON_CREDIT_PRODUCT,
  ZERO_CREDITS
}
