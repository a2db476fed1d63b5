package com.foliovault.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;
import java.time.Instant;

@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class InsurancePolicy {

    private boolean active;
    private BigInteger coverageAmount;
    private BigInteger premiumPaid;
    private Instant policyStartDate;

    public InsurancePolicy copy() {
        return new InsurancePolicy(active, coverageAmount, premiumPaid, policyStartDate);
    }
}
