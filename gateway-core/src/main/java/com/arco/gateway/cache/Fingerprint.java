package com.arco.gateway.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Deterministic cache key for a request: SHA-256 over the target and its parameters
 * serialized as canonical JSON (map keys sorted at every level), so insertion order
 * never changes the key.
 */
public final class Fingerprint {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private Fingerprint() {
    }

    public static String of(String target, Map<String, ?> params) {
        String canonical = target + ":" + canonicalJson(params == null ? Map.of() : params);
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256")
                    .digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String canonicalJson(Map<String, ?> params) {
        try {
            return CANONICAL.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request parameters are not serializable: " + e.getMessage(), e);
        }
    }
}
