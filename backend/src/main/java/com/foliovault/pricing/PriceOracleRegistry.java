package com.foliovault.pricing;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * All {@link PriceOracle} beans by source id (case-insensitive).
 */
@Component
public class PriceOracleRegistry {

    private final Map<String, PriceOracle> oracles = new LinkedHashMap<>();

    public PriceOracleRegistry(List<PriceOracle> oracles) {
        oracles.forEach(o -> this.oracles.put(key(o.sourceId()), o));
    }

    public Optional<PriceOracle> find(String sourceId) {
        if (sourceId == null || sourceId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(oracles.get(key(sourceId)));
    }

    public Set<String> sourceIds() {
        return Collections.unmodifiableSet(oracles.keySet());
    }

    private static String key(String sourceId) {
        return sourceId.trim().toLowerCase(Locale.ROOT);
    }
}
