package com.example.publisher.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

public enum MediaKind {
  VIDEO("video/mp4", ".mp4"),
  IMAGE("image/jpeg", ".jpg");

  private final String contentType;
  private final String defaultExtension;

  MediaKind(String contentType, String defaultExtension) {
    this.contentType = contentType;
    this.defaultExtension = defaultExtension;
  }

  /** アダプタは "video" / "image" の小文字で送ってくる。 */
  @JsonCreator
  public static MediaKind fromWire(String value) {
    if (value == null || value.isBlank()) {
      return VIDEO;
    }
    try {
      return MediaKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown media_type: " + value, ex);
    }
  }

  public String contentType() {
    return contentType;
  }

  public String defaultExtension() {
    return defaultExtension;
  }
}
