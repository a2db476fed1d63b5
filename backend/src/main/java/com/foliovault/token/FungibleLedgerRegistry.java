package com.foliovault.token;

import com.foliovault.domain.LedgerErrorCode;
import com.foliovault.domain.LedgerException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Token ledgers known to the vault, by token address (case-insensitive). One of them is the governance token
 * used for staking, rewards, insurance payouts and issuance.
 */
public class FungibleLedgerRegistry {

    private final Map<String, FungibleLedger> ledgers = new LinkedHashMap<>();
    private final String custodyAddress;
    private final String governanceTokenAddress;

    public FungibleLedgerRegistry(String custodyAddress, String governanceTokenAddress, Collection<? extends FungibleLedger> ledgers) {
        this.custodyAddress = custodyAddress;
        this.governanceTokenAddress = key(governanceTokenAddress);
        ledgers.forEach(l -> this.ledgers.put(key(l.tokenAddress()), l));
        if (!this.ledgers.containsKey(this.governanceTokenAddress)) {
            throw new IllegalArgumentException("Governance token " + governanceTokenAddress + " has no ledger");
        }
    }

    /**
     * @throws LedgerException UNKNOWN_TOKEN when no ledger is registered for the address
     */
    public FungibleLedger resolve(String tokenAddress) {
        FungibleLedger ledger = tokenAddress == null ? null : ledgers.get(key(tokenAddress));
        if (ledger == null) {
            throw new LedgerException(LedgerErrorCode.UNKNOWN_TOKEN, "No ledger for token " + tokenAddress);
        }
        return ledger;
    }

    public FungibleLedger governanceToken() {
        return ledgers.get(governanceTokenAddress);
    }

    public String custodyAddress() {
        return custodyAddress;
    }

    private static String key(String address) {
        return address.trim().toLowerCase(Locale.ROOT);
    }
}
