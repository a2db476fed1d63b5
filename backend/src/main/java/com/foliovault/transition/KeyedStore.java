package com.foliovault.transition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Journaled map of entities keyed by a stable identity (account address, symbol, proposal index).
 * Reads return copies and writes store copies, so callers never alias stored state. Writes are only accepted
 * while a transition is open; the first write to a key records its prior state for rollback.
 */
public class KeyedStore<K, V> implements Journaled {

    private final String name;
    private final UnaryOperator<V> copier;
    private final Map<K, V> entries = new HashMap<>();
    private Map<K, Prior<V>> undo;

    KeyedStore(String name, UnaryOperator<V> copier) {
        this.name = name;
        this.copier = copier;
    }

    public Optional<V> find(K key) {
        V v = entries.get(key);
        return v == null ? Optional.empty() : Optional.of(copier.apply(v));
    }

    public boolean contains(K key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public List<V> values() {
        List<V> out = new ArrayList<>(entries.size());
        entries.values().forEach(v -> out.add(copier.apply(v)));
        return out;
    }

    public void put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        remember(key);
        entries.put(key, copier.apply(value));
    }

    public void remove(K key) {
        remember(key);
        entries.remove(key);
    }

    private void remember(K key) {
        if (undo == null) {
            throw new IllegalStateException("Write to store '" + name + "' outside of a ledger transition");
        }
        if (!undo.containsKey(key)) {
            V prior = entries.get(key);
            undo.put(key, prior == null ? Prior.absent() : Prior.of(prior));
        }
    }

    @Override
    public void begin() {
        undo = new LinkedHashMap<>();
    }

    @Override
    public void commit() {
        undo = null;
    }

    @Override
    public void rollback() {
        if (undo == null) {
            return;
        }
        undo.forEach((key, prior) -> {
            if (prior.present()) {
                entries.put(key, prior.value());
            } else {
                entries.remove(key);
            }
        });
        undo = null;
    }

    @Override
    public String toString() {
        return "KeyedStore[" + name + ", size=" + entries.size() + "]";
    }

    private record Prior<V>(boolean present, V value) {

        static <V> Prior<V> of(V value) {
            return new Prior<>(true, value);
        }

        static <V> Prior<V> absent() {
            return new Prior<>(false, null);
        }
    }
}
