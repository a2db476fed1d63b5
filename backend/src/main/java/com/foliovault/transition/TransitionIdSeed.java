package com.foliovault.transition;

/**
 * Supplies the highest transition id already committed by an earlier run, so ids keep increasing across restarts.
 */
@FunctionalInterface
public interface TransitionIdSeed {

    TransitionIdSeed NONE = () -> 0L;

    long lastCommittedTransitionId();
}
