package com.foliovault.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;

/**
 * Named holding inside a portfolio. {@code value} is tracked independently of {@code amount}: oracle refreshes
 * derive it from the amount, rebalancing overwrites it directly.
 */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class Asset {

    private String symbol;
    private BigInteger amount;
    private BigInteger value;

    public Asset copy() {
        return new Asset(symbol, amount, value);
    }
}
