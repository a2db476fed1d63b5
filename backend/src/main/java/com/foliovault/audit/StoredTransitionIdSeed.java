package com.foliovault.audit;

import com.foliovault.domain.LedgerEvent;
import com.foliovault.domain.LedgerEventRepository;
import com.foliovault.transition.TransitionIdSeed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Resumes transition ids after the highest one in ledger_events. Falls back to zero when the store is unreachable;
 * records of the new run may then collide with stored ones and are dropped by the recorder.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StoredTransitionIdSeed implements TransitionIdSeed {

    private final LedgerEventRepository ledgerEventRepository;

    @Override
    public long lastCommittedTransitionId() {
        try {
            return ledgerEventRepository.findTopByOrderByTransitionIdDesc()
                    .map(LedgerEvent::getTransitionId)
                    .orElse(0L);
        } catch (DataAccessException e) {
            log.warn("Could not read the last transition id from ledger_events, starting at 0: {}", e.getMessage());
            return 0L;
        }
    }
}
