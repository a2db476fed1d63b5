package com.foliovault.api.dto;

import com.foliovault.domain.LedgerEvent;

import java.time.Instant;
import java.util.Map;

public record LedgerEventResponse(
        long transitionId,
        int sequence,
        String operation,
        String type,
        String account,
        Map<String, String> attributes,
        Instant recordedAt
) {

    public static LedgerEventResponse from(LedgerEvent e) {
        return new LedgerEventResponse(e.getTransitionId(), e.getSequence(), e.getOperation(),
                e.getType() != null ? e.getType().name() : null, e.getAccount(), e.getAttributes(), e.getRecordedAt());
    }
}
