package com.foliovault.token.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token host configuration. Documented in application.yml under foliovault.token.
 */
@ConfigurationProperties(prefix = "foliovault.token")
@Getter
@Setter
public class TokenProperties {

    /**
     * Account that holds tokens and native currency on behalf of the vault (staking custody, reward and
     * insurance payouts, flash-loan liquidity).
     */
    private String custodyAddress = "0x000000000000000000000000000000000000c0de";

    /**
     * Token staked for governance, paid out as staking reward and insurance coverage.
     */
    private String governanceToken = "0x00000000000000000000000000000000000060f7";

    /**
     * Token address -> (account -> opening balance). The governance token is always registered, even without
     * an entry here.
     */
    private Map<String, Map<String, BigInteger>> balances = new LinkedHashMap<>();

    /**
     * Account -> opening native balance.
     */
    private Map<String, BigInteger> nativeBalances = new HashMap<>();
}
