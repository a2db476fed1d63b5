package com.foliovault.token;

import com.foliovault.common.UintMath;
import com.foliovault.domain.LedgerErrorCode;
import com.foliovault.domain.LedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Account-side token operations exposed next to the vault: balance lookups and granting custody an allowance
 * (required before staking). Only host-managed ledgers accept approvals through this service.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenAccountService {

    private final FungibleLedgerRegistry fungibleLedgerRegistry;

    public BigInteger balanceOf(String tokenAddress, String account) {
        return fungibleLedgerRegistry.resolve(tokenAddress).balanceOf(account);
    }

    public BigInteger custodyAllowance(String tokenAddress, String owner) {
        return hostLedger(tokenAddress).allowance(owner, fungibleLedgerRegistry.custodyAddress());
    }

    /**
     * Sets the allowance {@code owner} grants to the custody account.
     *
     * @throws LedgerException INVALID_ARGUMENT for negative amounts, UNKNOWN_TOKEN for unknown or external ledgers
     */
    public void approveCustody(String tokenAddress, String owner, BigInteger amount) {
        if (!UintMath.isUint(amount)) {
            throw new LedgerException(LedgerErrorCode.INVALID_ARGUMENT, "Allowance must be non-negative");
        }
        hostLedger(tokenAddress).approve(owner, fungibleLedgerRegistry.custodyAddress(), amount);
        log.debug("Custody allowance of {} on {} set to {}", owner, tokenAddress, amount);
    }

    private InMemoryFungibleLedger hostLedger(String tokenAddress) {
        FungibleLedger ledger = fungibleLedgerRegistry.resolve(tokenAddress);
        if (ledger instanceof InMemoryFungibleLedger host) {
            return host;
        }
        throw new LedgerException(LedgerErrorCode.UNKNOWN_TOKEN, "Token " + tokenAddress + " is not host-managed");
    }
}
