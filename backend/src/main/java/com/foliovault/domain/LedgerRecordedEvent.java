package com.foliovault.domain;

import java.time.Instant;
import java.util.List;

/**
 * Application event: records of one committed transition. Consumed by {@link com.foliovault.audit.LedgerEventRecorder}.
 */
public record LedgerRecordedEvent(long transitionId, String operation, Instant committedAt, List<LedgerRecord> records) {
}
