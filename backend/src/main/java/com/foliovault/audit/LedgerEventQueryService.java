package com.foliovault.audit;

import com.foliovault.domain.LedgerEvent;
import com.foliovault.domain.LedgerEventRepository;
import com.foliovault.domain.LedgerEventType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reads the persisted audit log in commit order.
 */
@Service
@RequiredArgsConstructor
public class LedgerEventQueryService {

    private final LedgerEventRepository ledgerEventRepository;

    public List<LedgerEvent> findByAccount(String account) {
        if (account == null || account.isBlank()) {
            return List.of();
        }
        return ledgerEventRepository.findByAccountOrderByTransitionIdAscSequenceAsc(account);
    }

    public List<LedgerEvent> findByType(LedgerEventType type) {
        if (type == null) {
            return List.of();
        }
        return ledgerEventRepository.findByTypeOrderByTransitionIdAscSequenceAsc(type);
    }
}
