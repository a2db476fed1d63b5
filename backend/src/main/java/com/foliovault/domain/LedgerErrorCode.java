package com.foliovault.domain;

/**
 * Rejection reasons for ledger transitions. Every rejection aborts the whole transition.
 */
public enum LedgerErrorCode {
    NOT_OWNER,
    ALREADY_EXISTS,
    ALREADY_BOUND,
    ASSET_NOT_FOUND,
    INSUFFICIENT_BALANCE,
    INSUFFICIENT_STAKE,
    INVALID_PRICE,
    NO_ORACLE,
    REPAYMENT_FAILED,
    VOTING_CLOSED,
    ALREADY_EXECUTED,
    INVALID_ARGUMENT,
    NOTHING_TO_WITHDRAW,
    POLICY_INACTIVE,
    TRANSFER_FAILED,
    VALUE_UNDERFLOW,
    VALUE_OVERFLOW,
    UNKNOWN_TOKEN
}
