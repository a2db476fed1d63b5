package com.foliovault.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for ledger_events. Written by LedgerEventRecorder, read by LedgerEventQueryService.
 */
public interface LedgerEventRepository extends MongoRepository<LedgerEvent, String> {

    List<LedgerEvent> findByAccountOrderByTransitionIdAscSequenceAsc(String account);

    List<LedgerEvent> findByTypeOrderByTransitionIdAscSequenceAsc(LedgerEventType type);

    Optional<LedgerEvent> findTopByOrderByTransitionIdDesc();
}
