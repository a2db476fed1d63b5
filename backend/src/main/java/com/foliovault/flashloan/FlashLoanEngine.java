package com.foliovault.flashloan;

import com.foliovault.domain.Amounts;
import com.foliovault.domain.LedgerErrorCode;
import com.foliovault.domain.LedgerEventType;
import com.foliovault.domain.LedgerException;
import com.foliovault.domain.LedgerRecord;
import com.foliovault.flashloan.config.FlashLoanProperties;
import com.foliovault.token.FungibleLedgerRegistry;
import com.foliovault.token.NativeBalanceLedger;
import com.foliovault.transition.TransitionExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Single-transition loans of the custody account's native balance.
 * <p>
 * Repayment is verified by balance only: after the receiver runs, the borrower must hold at least
 * {@code amount + fee}. Nothing is pulled back into custody, so a borrower who already held the fee passes
 * without repaying. If the check fails the whole transition, disbursement included, is rolled back.
 */
@Service
@Slf4j
public class FlashLoanEngine {

    public static final BigInteger WAD = BigInteger.TEN.pow(18);

    private final TransitionExecutor transitions;
    private final NativeBalanceLedger nativeBalanceLedger;
    private final String custodyAddress;
    private final BigInteger feeRate;

    public FlashLoanEngine(TransitionExecutor transitions,
                           NativeBalanceLedger nativeBalanceLedger,
                           FungibleLedgerRegistry fungibleLedgerRegistry,
                           FlashLoanProperties properties) {
        this.transitions = transitions;
        this.nativeBalanceLedger = nativeBalanceLedger;
        this.custodyAddress = fungibleLedgerRegistry.custodyAddress();
        this.feeRate = Amounts.requireUint(properties.getFeeRate(), "feeRate");
    }

    public FlashLoanReceipt borrow(String caller, BigInteger amount) {
        return borrow(caller, amount, FlashLoanReceiver.NONE);
    }

    /**
     * @throws LedgerException INSUFFICIENT_BALANCE when custody cannot cover {@code amount}, REPAYMENT_FAILED when
     *                         the borrower's balance after the callback is below {@code amount + fee}
     */
    public FlashLoanReceipt borrow(String caller, BigInteger amount, FlashLoanReceiver receiver) {
        Amounts.requireText(caller, "caller");
        Amounts.requirePositive(amount, "amount");
        FlashLoanReceiver callback = receiver != null ? receiver : FlashLoanReceiver.NONE;
        return transitions.execute("flashLoan", () -> {
            BigInteger available = nativeBalanceLedger.balanceOf(custodyAddress);
            if (amount.compareTo(available) > 0) {
                throw new LedgerException(LedgerErrorCode.INSUFFICIENT_BALANCE,
                        "Flash loan of " + amount + " exceeds available liquidity " + available);
            }
            BigInteger fee = fee(amount);
            BigInteger before = nativeBalanceLedger.balanceOf(caller);
            if (!nativeBalanceLedger.transfer(custodyAddress, caller, amount)) {
                throw new LedgerException(LedgerErrorCode.TRANSFER_FAILED, "Flash loan disbursement to " + caller + " failed");
            }
            log.debug("Flash loan {} to {} {}", amount, caller, FlashLoanPhase.DISBURSED);

            callback.onFlashLoan(caller, amount, fee);

            BigInteger after = nativeBalanceLedger.balanceOf(caller);
            BigInteger owed = Amounts.add(amount, fee);
            if (after.compareTo(owed) < 0) {
                throw new LedgerException(LedgerErrorCode.REPAYMENT_FAILED,
                        "Borrower balance " + after + " below principal plus fee " + owed);
            }
            transitions.emit(LedgerRecord.of(LedgerEventType.FLASH_LOAN_TAKEN, caller, "amount", amount, "fee", fee));
            log.info("Flash loan of {} (fee {}) to {} verified", amount, fee, caller);
            return new FlashLoanReceipt(caller, amount, fee, FlashLoanPhase.REPAYMENT_VERIFIED, before, after);
        });
    }

    public BigInteger fee(BigInteger amount) {
        return Amounts.mulDiv(Amounts.requireUint(amount, "amount"), feeRate, WAD);
    }

    public BigInteger availableLiquidity() {
        return nativeBalanceLedger.balanceOf(custodyAddress);
    }
}
