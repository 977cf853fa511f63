package com.example.publisher.service;

public class WebhookPayloadException extends RuntimeException {

  public WebhookPayloadException(String message) {
    super(message);
  }

  public WebhookPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
