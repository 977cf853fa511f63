package com.example.publisher.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConnectCredentialRequest(
    @NotBlank(message = "code is required") String code,
    String redirectUri,
    String providerUserId,
    String email) {}
