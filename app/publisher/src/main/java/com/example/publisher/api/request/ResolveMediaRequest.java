package com.example.publisher.api.request;

import com.example.publisher.model.MediaKind;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResolveMediaRequest(
    @NotBlank(message = "source_url is required") String sourceUrl, MediaKind mediaType) {

  public ResolveMediaRequest {
    mediaType = mediaType == null ? MediaKind.VIDEO : mediaType;
  }
}
