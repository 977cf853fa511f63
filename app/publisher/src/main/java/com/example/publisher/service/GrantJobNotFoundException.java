package com.example.publisher.service;

import java.util.UUID;

public class GrantJobNotFoundException extends RuntimeException {

  public GrantJobNotFoundException(UUID jobId) {
    super("failed credit grant job not found: " + jobId);
  }
}
