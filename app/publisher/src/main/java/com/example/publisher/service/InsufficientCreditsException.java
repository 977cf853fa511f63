package com.example.publisher.service;

public class InsufficientCreditsException extends RuntimeException {

  private final long requested;

  public InsufficientCreditsException(long requested) {
    super("insufficient credits: requested=" + requested);
    this.requested = requested;
  }

  public long requested() {
    return requested;
  }
}
