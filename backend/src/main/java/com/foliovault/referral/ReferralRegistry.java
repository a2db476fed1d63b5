package com.foliovault.referral;

import com.foliovault.domain.Amounts;
import com.foliovault.domain.LedgerErrorCode;
import com.foliovault.domain.LedgerEventType;
import com.foliovault.domain.LedgerException;
import com.foliovault.domain.LedgerRecord;
import com.foliovault.transition.KeyedStore;
import com.foliovault.transition.TransitionExecutor;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Write-once referred account -> referrer edges.
 */
@Service
public class ReferralRegistry {

    private final TransitionExecutor transitions;
    private final KeyedStore<String, String> referrers;

    public ReferralRegistry(TransitionExecutor transitions) {
        this.transitions = transitions;
        this.referrers = transitions.newStore("referrers", UnaryOperator.identity());
    }

    /**
     * @throws LedgerException ALREADY_EXISTS when {@code newUser} already has a referrer
     */
    public void refer(String caller, String newUser) {
        Amounts.requireText(caller, "caller");
        Amounts.requireText(newUser, "newUser");
        transitions.run("refer", () -> {
            if (referrers.contains(newUser)) {
                throw new LedgerException(LedgerErrorCode.ALREADY_EXISTS, newUser + " already has a referrer");
            }
            referrers.put(newUser, caller);
            transitions.emit(LedgerRecord.of(LedgerEventType.REFERRAL_RECORDED, newUser, "referrer", caller));
        });
    }

    public Optional<String> findReferrer(String account) {
        return transitions.read(() -> referrers.find(account));
    }
}
