package com.foliovault.token;

import com.foliovault.domain.LedgerErrorCode;
import com.foliovault.domain.LedgerException;

import java.math.BigInteger;

/**
 * Turns failed ledger calls into {@link LedgerErrorCode#TRANSFER_FAILED} so the transition aborts.
 */
public final class TokenTransfers {

    private TokenTransfers() {
    }

    public static void pay(FungibleLedger ledger, String to, BigInteger amount) {
        boolean ok;
        try {
            ok = ledger.transfer(to, amount);
        } catch (LedgerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LedgerException(LedgerErrorCode.TRANSFER_FAILED,
                    "Transfer of " + amount + " " + ledger.tokenAddress() + " to " + to + " failed", e);
        }
        if (!ok) {
            throw new LedgerException(LedgerErrorCode.TRANSFER_FAILED,
                    "Transfer of " + amount + " " + ledger.tokenAddress() + " to " + to + " rejected");
        }
    }

    public static void pull(FungibleLedger ledger, String from, String to, BigInteger amount) {
        boolean ok;
        try {
            ok = ledger.transferFrom(from, to, amount);
        } catch (LedgerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LedgerException(LedgerErrorCode.TRANSFER_FAILED,
                    "transferFrom " + from + " of " + amount + " " + ledger.tokenAddress() + " failed", e);
        }
        if (!ok) {
            throw new LedgerException(LedgerErrorCode.TRANSFER_FAILED,
                    "transferFrom " + from + " of " + amount + " " + ledger.tokenAddress() + " rejected");
        }
    }
}
