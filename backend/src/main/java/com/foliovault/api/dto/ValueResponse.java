package com.foliovault.api.dto;

import java.math.BigInteger;

/**
 * Single amount result (refreshed value, withdrawn value, reward, balance).
 */
public record ValueResponse(BigInteger value) {
}
