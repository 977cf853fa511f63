package com.example.publisher.model;

public enum GrantJobStatus {
  PENDING,
  IN_FLIGHT,
  COMPLETED,
  FAILED
}
