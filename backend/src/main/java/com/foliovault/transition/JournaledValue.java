package com.foliovault.transition;

import java.util.Objects;

/**
 * Journaled single value (global counters such as totalStaked). Holds immutable values only.
 */
public class JournaledValue<T> implements Journaled {

    private final String name;
    private T value;
    private T prior;
    private boolean open;
    private boolean dirty;

    JournaledValue(String name, T initial) {
        this.name = name;
        this.value = Objects.requireNonNull(initial, "initial");
    }

    public T get() {
        return value;
    }

    public void set(T newValue) {
        if (!open) {
            throw new IllegalStateException("Write to value '" + name + "' outside of a ledger transition");
        }
        if (!dirty) {
            prior = value;
            dirty = true;
        }
        value = Objects.requireNonNull(newValue, "value");
    }

    @Override
    public void begin() {
        open = true;
        dirty = false;
        prior = null;
    }

    @Override
    public void commit() {
        open = false;
        dirty = false;
        prior = null;
    }

    @Override
    public void rollback() {
        if (dirty) {
            value = prior;
        }
        commit();
    }
}
