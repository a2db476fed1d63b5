package com.foliovault.audit;

import com.foliovault.config.AsyncConfig;
import com.foliovault.domain.LedgerEvent;
import com.foliovault.domain.LedgerEventRepository;
import com.foliovault.domain.LedgerRecord;
import com.foliovault.domain.LedgerRecordedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Persists the records of each committed transition to ledger_events. Runs on the audit executor, so a slow or
 * unavailable database never blocks or fails a ledger operation; persistence failures are logged and dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerEventRecorder {

    private final LedgerEventRepository ledgerEventRepository;

    @Async(AsyncConfig.AUDIT_EXECUTOR)
    @EventListener
    public void onLedgerRecorded(LedgerRecordedEvent event) {
        if (event.records() == null || event.records().isEmpty()) {
            return;
        }
        List<LedgerEvent> documents = toDocuments(event);
        try {
            ledgerEventRepository.saveAll(documents);
            log.debug("Persisted {} ledger event(s) of transition {} ({})",
                    documents.size(), event.transitionId(), event.operation());
        } catch (DataAccessException e) {
            log.warn("Failed to persist {} ledger event(s) of transition {} ({}): {}",
                    documents.size(), event.transitionId(), event.operation(), e.getMessage());
        }
    }

    static List<LedgerEvent> toDocuments(LedgerRecordedEvent event) {
        List<LedgerEvent> documents = new ArrayList<>(event.records().size());
        int sequence = 0;
        for (LedgerRecord record : event.records()) {
            LedgerEvent doc = new LedgerEvent();
            doc.setTransitionId(event.transitionId());
            doc.setSequence(sequence++);
            doc.setOperation(event.operation());
            doc.setType(record.type());
            doc.setAccount(record.account());
            doc.setAttributes(new HashMap<>(record.attributes()));
            doc.setRecordedAt(event.committedAt());
            documents.add(doc);
        }
        return documents;
    }
}
