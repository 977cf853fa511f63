package com.example.publisher.model;

import java.util.Locale;

public enum Provider {
  TIKTOK,
  YOUTUBE,
  INSTAGRAM,
  FACEBOOK,
  LINKEDIN,
  TWITTER;

  /** パス変数などの小文字表記を受け付ける。未知の値は IllegalArgumentException。 */
  public static Provider fromPath(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("provider is required");
    }
    try {
      return Provider.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown provider: " + value, ex);
    }
  }
}
