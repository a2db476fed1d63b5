package com.foliovault.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit entry emitted by a transition: event type, the account it concerns and the operation's key arguments.
 */
public record LedgerRecord(LedgerEventType type, String account, Map<String, String> attributes) {

    public LedgerRecord {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Builds a record from alternating attribute names and values; values are stored via {@code String.valueOf}.
     */
    public static LedgerRecord of(LedgerEventType type, String account, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must be name/value pairs");
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            attributes.put(String.valueOf(keyValues[i]), String.valueOf(keyValues[i + 1]));
        }
        return new LedgerRecord(type, account, attributes);
    }
}
