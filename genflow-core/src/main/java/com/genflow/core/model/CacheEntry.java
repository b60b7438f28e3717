package com.genflow.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A cached value. Kept in memory and mirrored to one file per key.
 * Logically absent once {@code now >= expiresAt}.
 *
 * @param expiresAt null means the entry never expires
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CacheEntry(
    String key,
    JsonNode value,
    Instant storedAt,
    Instant expiresAt,
    JsonNode metadata
) {
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
