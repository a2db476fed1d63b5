package com.foliovault.api.controller;

import com.foliovault.api.dto.LedgerEventResponse;
import com.foliovault.api.validation.AddressValidator;
import com.foliovault.audit.LedgerEventQueryService;
import com.foliovault.domain.LedgerEventType;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Audit log reads, in commit order. Persistence is asynchronous, so the latest records may lag briefly.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class LedgerEventController {

    private final AddressValidator addressValidator;
    private final LedgerEventQueryService ledgerEventQueryService;

    @GetMapping("/accounts/{account}/events")
    public ResponseEntity<List<LedgerEventResponse>> events(@PathVariable String account) {
        String normalized = addressValidator.normalize(account, "account");
        return ResponseEntity.ok(ledgerEventQueryService.findByAccount(normalized).stream()
                .map(LedgerEventResponse::from)
                .toList());
    }

    /** All records of one type across accounts, e.g. every SLASHED or INSURANCE_CLAIMED entry. */
    @GetMapping("/events")
    public ResponseEntity<List<LedgerEventResponse>> eventsByType(@RequestParam LedgerEventType type) {
        return ResponseEntity.ok(ledgerEventQueryService.findByType(type).stream()
                .map(LedgerEventResponse::from)
                .toList());
    }
}
