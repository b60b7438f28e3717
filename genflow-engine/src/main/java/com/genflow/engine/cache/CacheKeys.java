package com.genflow.engine.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;

/**
 * Deterministic cache keys.
 *
 * <p>The inputs are serialized together as one JSON array with sorted object keys,
 * and the key is the first 16 hex characters of its SHA-256. Strings stay quoted,
 * so {@code "1"} and {@code 1} produce different keys.
 */
public final class CacheKeys {
    
    public static final int KEY_LENGTH = 16;
    
    private static final ObjectMapper CANONICAL = JsonMapper.builder()
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .build();
    
    private CacheKeys() {
    }
    
    public static String generate(Object... inputs) {
        return sha256Hex(canonical(Arrays.asList(inputs))).substring(0, KEY_LENGTH);
    }
    
    /**
     * Full lowercase hex SHA-256 of the UTF-8 bytes.
     */
    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
    
    private static String canonical(List<Object> inputs) {
        try {
            return CANONICAL.writeValueAsString(inputs);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache key inputs are not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
