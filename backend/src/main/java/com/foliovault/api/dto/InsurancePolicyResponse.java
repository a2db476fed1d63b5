package com.foliovault.api.dto;

import com.foliovault.domain.InsurancePolicy;

import java.math.BigInteger;
import java.time.Instant;

public record InsurancePolicyResponse(
        String account,
        boolean active,
        BigInteger coverageAmount,
        BigInteger premiumPaid,
        Instant policyStartDate
) {

    public static InsurancePolicyResponse from(String account, InsurancePolicy policy) {
        return new InsurancePolicyResponse(account, policy.isActive(), policy.getCoverageAmount(),
                policy.getPremiumPaid(), policy.getPolicyStartDate());
    }
}
