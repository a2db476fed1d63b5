package com.foliovault.transition;

/**
 * State that takes part in ledger transitions. Between {@link #begin()} and {@link #commit()} or
 * {@link #rollback()} the participant keeps enough history to restore its state at {@code begin()}.
 */
public interface Journaled {

    void begin();

    void commit();

    void rollback();
}
