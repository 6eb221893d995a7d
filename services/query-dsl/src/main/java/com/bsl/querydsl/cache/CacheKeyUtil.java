package com.bsl.querydsl.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;

public final class CacheKeyUtil {
    // Map keys are written sorted at every depth; list order is part of the key.
    private static final ObjectMapper SORTED_MAPPER = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private CacheKeyUtil() {
    }

    public static String buildKey(String prefix, Collection<String> indexNames, Object body) {
        StringBuilder key = new StringBuilder(prefix == null ? "" : prefix);
        if (indexNames != null && !indexNames.isEmpty()) {
            key.append(String.join(":", indexNames)).append(':');
        }
        return key.append(hashJson(body)).toString();
    }

    public static String sortedJson(Object value) {
        try {
            return SORTED_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Query body is not serializable", e);
        }
    }

    public static String hashJson(Object value) {
        return sha256(sortedJson(value));
    }

    public static String sha256(String value) {
        if (value == null) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                builder.append(String.format("%02x", b));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
