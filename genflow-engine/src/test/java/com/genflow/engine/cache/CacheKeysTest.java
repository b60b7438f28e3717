package com.genflow.engine.cache;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CacheKeysTest {

    @Test
    void generate_shouldReturnShortHexKey() {
        String key = CacheKeys.generate("prd", "a todo app");

        assertThat(key).hasSize(CacheKeys.KEY_LENGTH).matches("[0-9a-f]+");
        assertThat(CacheKeys.generate("prd", "a todo app")).isEqualTo(key);
    }

    @Test
    void generate_shouldDependOnEveryInputAndOrder() {
        assertThat(CacheKeys.generate("a", "b")).isNotEqualTo(CacheKeys.generate("b", "a"));
        assertThat(CacheKeys.generate("a", "b")).isNotEqualTo(CacheKeys.generate("a", "c"));
        assertThat(CacheKeys.generate("a", null)).isNotEqualTo(CacheKeys.generate("a"));
    }

    @Test
    void generate_shouldNotCollideOnSeparatorsOrTypes() {
        assertThat(CacheKeys.generate("a|b")).isNotEqualTo(CacheKeys.generate("a", "b"));
        assertThat(CacheKeys.generate("1")).isNotEqualTo(CacheKeys.generate(1));
        assertThat(CacheKeys.generate("null")).isNotEqualTo(CacheKeys.generate((Object) null));
        assertThat(CacheKeys.generate("[\"a\",\"b\"]")).isNotEqualTo(CacheKeys.generate("a", "b"));
    }

    @Test
    void generate_shouldIgnoreMapInsertionOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("temperature", 0.2);
        first.put("maxTokens", 4000);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("maxTokens", 4000);
        second.put("temperature", 0.2);

        assertThat(CacheKeys.generate("p", first)).isEqualTo(CacheKeys.generate("p", second));
    }

    @Test
    void sha256Hex_shouldMatchKnownDigest() {
        assertThat(CacheKeys.sha256Hex("abc"))
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }
}
