package com.example.publisher.model;

import java.util.UUID;

public record CreditGrantJob(
    UUID jobId, String eventId, String ownerKey, long credits, int attemptCount) {}
