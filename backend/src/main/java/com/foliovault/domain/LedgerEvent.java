package com.foliovault.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Persisted audit record. One document per {@link LedgerRecord}; (transitionId, sequence) is unique.
 */
@Document(collection = "ledger_events")
@CompoundIndex(name = "transition_sequence", def = "{'transitionId': 1, 'sequence': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
public class LedgerEvent {

    @Id
    private String id;
    private long transitionId;
    private int sequence;
    private String operation;
    @Indexed
    private LedgerEventType type;
    @Indexed
    private String account;
    private Map<String, String> attributes = new HashMap<>();
    private Instant recordedAt;
}
