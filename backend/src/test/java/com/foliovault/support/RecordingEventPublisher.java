package com.foliovault.support;

import com.foliovault.domain.LedgerRecord;
import com.foliovault.domain.LedgerRecordedEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.List;

public class RecordingEventPublisher implements ApplicationEventPublisher {

    private final List<Object> events = new ArrayList<>();

    @Override
    public void publishEvent(Object event) {
        events.add(event);
    }

    public List<LedgerRecordedEvent> ledgerEvents() {
        return events.stream()
                .filter(LedgerRecordedEvent.class::isInstance)
                .map(LedgerRecordedEvent.class::cast)
                .toList();
    }

    public List<LedgerRecord> records() {
        return ledgerEvents().stream().flatMap(e -> e.records().stream()).toList();
    }

    public void clear() {
        events.clear();
    }
}
