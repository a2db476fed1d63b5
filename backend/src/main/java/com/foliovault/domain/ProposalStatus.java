package com.foliovault.domain;

/**
 * OPEN while now &lt; votingDeadline; CLOSED afterwards; EXECUTED once the flag is set (no operation sets it yet).
 */
public enum ProposalStatus {
    OPEN,
    CLOSED,
    EXECUTED
}
