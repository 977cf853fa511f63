package com.example.publisher.model;

public enum AccountStatus {
  ACTIVE,
  REVOKED
}
