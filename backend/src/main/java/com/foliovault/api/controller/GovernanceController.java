package com.foliovault.api.controller;

import com.foliovault.api.dto.CreateProposalRequest;
import com.foliovault.api.dto.GovernanceSummaryResponse;
import com.foliovault.api.dto.IssueTokensRequest;
import com.foliovault.api.dto.ProposalResponse;
import com.foliovault.api.dto.VoteRequest;
import com.foliovault.api.validation.AddressValidator;
import com.foliovault.domain.Proposal;
import com.foliovault.governance.GovernanceModule;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;

@RestController
@RequestMapping("/api/v1/governance")
@RequiredArgsConstructor
public class GovernanceController {

    private final AddressValidator addressValidator;
    private final GovernanceModule governanceModule;
    private final Clock clock;

    @PostMapping("/proposals")
    public ResponseEntity<ProposalResponse> createProposal(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account,
                                                           @RequestBody @Valid CreateProposalRequest request) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        int id = governanceModule.createProposal(caller, request.description(),
                Duration.ofSeconds(request.votingPeriodSeconds()));
        Proposal proposal = governanceModule.findProposal(id).orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(ProposalResponse.from(proposal, clock.instant()));
    }

    @PostMapping("/proposals/{id}/votes")
    public ResponseEntity<ProposalResponse> vote(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account,
                                                 @PathVariable int id,
                                                 @RequestBody @Valid VoteRequest request) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        Proposal proposal = governanceModule.vote(caller, id, request.votes());
        return ResponseEntity.ok(ProposalResponse.from(proposal, clock.instant()));
    }

    @GetMapping("/proposals/{id}")
    public ResponseEntity<ProposalResponse> getProposal(@PathVariable int id) {
        return governanceModule.findProposal(id)
                .map(p -> ResponseEntity.ok(ProposalResponse.from(p, clock.instant())))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/summary")
    public ResponseEntity<GovernanceSummaryResponse> summary() {
        return ResponseEntity.ok(new GovernanceSummaryResponse(governanceModule.proposalCount(), governanceModule.totalVotes()));
    }

    @PostMapping("/token-issuances")
    public ResponseEntity<Void> issueGovernanceTokens(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account,
                                                      @RequestBody @Valid IssueTokensRequest request) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        governanceModule.issueGovernanceTokens(caller, addressValidator.normalize(request.to(), "to"), request.amount());
        return ResponseEntity.noContent().build();
    }
}
