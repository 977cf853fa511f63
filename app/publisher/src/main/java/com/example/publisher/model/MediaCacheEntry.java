package com.example.publisher.model;

import java.time.Instant;

public record MediaCacheEntry(
    String contentHash, String canonicalUrl, MediaKind mediaType, Instant createdAt) {}
