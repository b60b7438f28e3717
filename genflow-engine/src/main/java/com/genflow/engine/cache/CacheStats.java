package com.genflow.engine.cache;

/**
 * Point-in-time size of both cache tiers.
 */
public record CacheStats(int memoryEntries, int diskEntries, long diskBytes) {
}
