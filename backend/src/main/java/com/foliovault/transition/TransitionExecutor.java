package com.foliovault.transition;

import com.foliovault.domain.LedgerRecord;
import com.foliovault.domain.LedgerRecordedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Runs every ledger entry point as one indivisible transition. A single fair lock serializes transitions;
 * registered {@link Journaled} participants are rolled back when the body throws, and the transition's
 * {@link LedgerRecord}s are published as one {@link LedgerRecordedEvent} only after commit.
 * <p>
 * Calls made while a transition is already open on the current thread (a flash-loan receiver invoking another
 * entry point) join that transition instead of starting a new one.
 */
@Component
@Slf4j
public class TransitionExecutor {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final List<Journaled> participants = new CopyOnWriteArrayList<>();
    private final AtomicLong transitionIds = new AtomicLong();
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    /** Guarded by {@link #lock}. */
    private Transition current;

    public TransitionExecutor(ApplicationEventPublisher applicationEventPublisher, Clock clock) {
        this(applicationEventPublisher, clock, TransitionIdSeed.NONE);
    }

    @Autowired
    public TransitionExecutor(ApplicationEventPublisher applicationEventPublisher, Clock clock, TransitionIdSeed seed) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
        long last = Math.max(0L, seed.lastCommittedTransitionId());
        transitionIds.set(last);
        if (last > 0) {
            log.info("Transition ids resume after {}", last);
        }
    }

    public <K, V> KeyedStore<K, V> newStore(String name, UnaryOperator<V> copier) {
        KeyedStore<K, V> store = new KeyedStore<>(name, copier);
        register(store);
        return store;
    }

    public <T> JournaledValue<T> newValue(String name, T initial) {
        JournaledValue<T> value = new JournaledValue<>(name, initial);
        register(value);
        return value;
    }

    /**
     * Adds a participant. Registration while a transition is open is rejected: the participant would miss
     * {@code begin()}.
     */
    public void register(Journaled participant) {
        lock.lock();
        try {
            if (current != null) {
                throw new IllegalStateException("Cannot register a participant inside a transition");
            }
            participants.add(participant);
        } finally {
            lock.unlock();
        }
    }

    public <T> T execute(String operation, Supplier<T> body) {
        Transition committed;
        T result;
        lock.lock();
        try {
            if (current != null) {
                return body.get();
            }
            Transition tx = new Transition(transitionIds.incrementAndGet(), operation);
            current = tx;
            participants.forEach(Journaled::begin);
            try {
                result = body.get();
            } catch (RuntimeException | Error e) {
                for (int i = participants.size() - 1; i >= 0; i--) {
                    participants.get(i).rollback();
                }
                log.debug("Transition {} ({}) rolled back: {}", tx.id, operation, e.getMessage());
                throw e;
            } finally {
                current = null;
            }
            participants.forEach(Journaled::commit);
            committed = tx;
        } finally {
            lock.unlock();
        }
        publish(committed);
        return result;
    }

    public void run(String operation, Runnable body) {
        execute(operation, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Reads ledger state under the transition lock so no half-applied transition is observable.
     */
    public <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Buffers an audit record on the open transition; it is published only if the transition commits.
     */
    public void emit(LedgerRecord record) {
        if (!lock.isHeldByCurrentThread() || current == null) {
            throw new IllegalStateException("emit() requires an open transition");
        }
        current.records.add(record);
    }

    private void publish(Transition tx) {
        if (tx.records.isEmpty()) {
            return;
        }
        log.debug("Transition {} ({}) committed with {} record(s)", tx.id, tx.operation, tx.records.size());
        applicationEventPublisher.publishEvent(
                new LedgerRecordedEvent(tx.id, tx.operation, clock.instant(), List.copyOf(tx.records)));
    }

    private static final class Transition {
        private final long id;
        private final String operation;
        private final List<LedgerRecord> records = new ArrayList<>();

        private Transition(long id, String operation) {
            this.id = id;
            this.operation = operation;
        }
    }
}
