package com.foliovault.api.dto;

import java.math.BigInteger;

public record GovernanceSummaryResponse(int proposalCount, BigInteger totalVotes) {
}
