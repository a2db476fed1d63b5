package com.foliovault.api.dto;

import com.foliovault.domain.Proposal;
import com.foliovault.domain.ProposalStatus;

import java.math.BigInteger;
import java.time.Instant;

public record ProposalResponse(
        int id,
        String description,
        BigInteger voteCount,
        boolean executed,
        Instant createdAt,
        Instant votingDeadline,
        ProposalStatus status
) {

    public static ProposalResponse from(Proposal p, Instant now) {
        return new ProposalResponse(p.getId(), p.getDescription(), p.getVoteCount(), p.isExecuted(),
                p.getCreatedAt(), p.getVotingDeadline(), p.statusAt(now));
    }
}
