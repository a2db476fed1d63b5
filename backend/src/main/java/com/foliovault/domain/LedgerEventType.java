package com.foliovault.domain;

public enum LedgerEventType {
    PORTFOLIO_INITIALIZED,
    ASSET_ADDED,
    PRICE_FEED_BOUND,
    ASSET_VALUE_UPDATED,
    WITHDRAWAL,
    EMERGENCY_WITHDRAWAL,
    REBALANCED,
    FEES_APPLIED,
    PORTFOLIO_CONFIGURED,
    VALUE_SNAPSHOT,
    STAKED,
    UNSTAKED,
    STAKING_REWARD_CLAIMED,
    SLASHED,
    FLASH_LOAN_TAKEN,
    GOVERNANCE_TOKENS_ISSUED,
    PROPOSAL_CREATED,
    VOTE_CAST,
    INSURANCE_PURCHASED,
    INSURANCE_CLAIMED,
    REFERRAL_RECORDED
}
