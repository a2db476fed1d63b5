package com.foliovault.governance;

import com.foliovault.domain.Amounts;
import com.foliovault.domain.LedgerErrorCode;
import com.foliovault.domain.LedgerEventType;
import com.foliovault.domain.LedgerException;
import com.foliovault.domain.LedgerRecord;
import com.foliovault.domain.Proposal;
import com.foliovault.governance.config.GovernanceProperties;
import com.foliovault.token.FungibleLedgerRegistry;
import com.foliovault.token.TokenTransfers;
import com.foliovault.transition.JournaledValue;
import com.foliovault.transition.KeyedStore;
import com.foliovault.transition.TransitionExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Proposals and vote tallies. Vote weight is whatever the caller supplies; it is not checked against stake or
 * token balance, and an account may vote any number of times.
 */
@Service
@Slf4j
public class GovernanceModule {

    private final TransitionExecutor transitions;
    private final FungibleLedgerRegistry fungibleLedgerRegistry;
    private final GovernanceProperties properties;
    private final Clock clock;
    private final KeyedStore<Integer, Proposal> proposals;
    private final JournaledValue<BigInteger> totalVotes;

    public GovernanceModule(TransitionExecutor transitions,
                            FungibleLedgerRegistry fungibleLedgerRegistry,
                            GovernanceProperties properties,
                            Clock clock) {
        this.transitions = transitions;
        this.fungibleLedgerRegistry = fungibleLedgerRegistry;
        this.properties = properties;
        this.clock = clock;
        this.proposals = transitions.newStore("proposals", Proposal::copy);
        this.totalVotes = transitions.newValue("total-votes", BigInteger.ZERO);
    }

    /**
     * @return index of the new proposal
     */
    public int createProposal(String caller, String description, Duration votingPeriod) {
        Amounts.requireText(caller, "caller");
        Amounts.requireText(description, "description");
        if (votingPeriod == null || votingPeriod.isZero() || votingPeriod.isNegative()) {
            throw new LedgerException(LedgerErrorCode.INVALID_ARGUMENT, "votingPeriod must be positive");
        }
        return transitions.execute("createProposal", () -> {
            int id = proposals.size();
            Instant now = clock.instant();
            Proposal proposal = new Proposal(id, description, BigInteger.ZERO, false, now, now.plus(votingPeriod));
            proposals.put(id, proposal);
            transitions.emit(LedgerRecord.of(LedgerEventType.PROPOSAL_CREATED, caller,
                    "proposalId", id, "votingDeadline", proposal.getVotingDeadline()));
            log.info("Proposal {} created by {}, voting until {}", id, caller, proposal.getVotingDeadline());
            return id;
        });
    }

    /**
     * @throws LedgerException INVALID_ARGUMENT for an unknown proposal or non-positive votes, ALREADY_EXECUTED,
     *                         VOTING_CLOSED once the deadline is reached
     */
    public Proposal vote(String caller, int proposalId, BigInteger votes) {
        Amounts.requireText(caller, "caller");
        Amounts.requirePositive(votes, "votes");
        return transitions.execute("vote", () -> {
            Proposal proposal = proposals.find(proposalId)
                    .orElseThrow(() -> new LedgerException(LedgerErrorCode.INVALID_ARGUMENT, "Unknown proposal " + proposalId));
            if (proposal.isExecuted()) {
                throw new LedgerException(LedgerErrorCode.ALREADY_EXECUTED, "Proposal " + proposalId + " already executed");
            }
            if (!clock.instant().isBefore(proposal.getVotingDeadline())) {
                throw new LedgerException(LedgerErrorCode.VOTING_CLOSED,
                        "Voting on proposal " + proposalId + " closed at " + proposal.getVotingDeadline());
            }
            proposal.setVoteCount(Amounts.add(proposal.getVoteCount(), votes));
            proposals.put(proposalId, proposal);
            totalVotes.set(Amounts.add(totalVotes.get(), votes));
            transitions.emit(LedgerRecord.of(LedgerEventType.VOTE_CAST, caller,
                    "proposalId", proposalId, "votes", votes, "voteCount", proposal.getVoteCount()));
            return proposal;
        });
    }

    /**
     * Pays governance tokens from custody.
     *
     * @throws LedgerException NOT_OWNER unless the caller is the configured admin
     */
    public void issueGovernanceTokens(String caller, String to, BigInteger amount) {
        Amounts.requireText(to, "to");
        Amounts.requirePositive(amount, "amount");
        String admin = properties.getAdminAddress();
        if (caller == null || admin == null || !admin.equalsIgnoreCase(caller)) {
            throw new LedgerException(LedgerErrorCode.NOT_OWNER, caller + " may not issue governance tokens");
        }
        transitions.run("issueGovernanceTokens", () -> {
            TokenTransfers.pay(fungibleLedgerRegistry.governanceToken(), to, amount);
            transitions.emit(LedgerRecord.of(LedgerEventType.GOVERNANCE_TOKENS_ISSUED, to, "amount", amount, "issuer", caller));
            log.info("Issued {} governance tokens to {}", amount, to);
        });
    }

    public Optional<Proposal> findProposal(int proposalId) {
        return transitions.read(() -> proposals.find(proposalId));
    }

    public int proposalCount() {
        return transitions.read(proposals::size);
    }

    public BigInteger totalVotes() {
        return transitions.read(totalVotes::get);
    }
}
