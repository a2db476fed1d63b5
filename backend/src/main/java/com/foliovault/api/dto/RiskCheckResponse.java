package com.foliovault.api.dto;

import java.math.BigInteger;

public record RiskCheckResponse(boolean withinRiskBand, BigInteger totalValue) {
}
