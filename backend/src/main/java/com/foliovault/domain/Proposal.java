package com.foliovault.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Time-boxed governance record, indexed by creation order.
 */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class Proposal {

    private int id;
    private String description;
    private BigInteger voteCount = BigInteger.ZERO;
    private boolean executed;
    private Instant createdAt;
    private Instant votingDeadline;

    public ProposalStatus statusAt(Instant now) {
        if (executed) {
            return ProposalStatus.EXECUTED;
        }
        return now.isBefore(votingDeadline) ? ProposalStatus.OPEN : ProposalStatus.CLOSED;
    }

    public Proposal copy() {
        return new Proposal(id, description, voteCount, executed, createdAt, votingDeadline);
    }
}
