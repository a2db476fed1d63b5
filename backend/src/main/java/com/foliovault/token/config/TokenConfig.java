package com.foliovault.token.config;

import com.foliovault.token.FungibleLedgerRegistry;
import com.foliovault.token.InMemoryFungibleLedger;
import com.foliovault.token.InMemoryNativeBalanceLedger;
import com.foliovault.transition.TransitionExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Wires the in-memory token and native ledgers and seeds their opening balances.
 */
@Configuration
@EnableConfigurationProperties(TokenProperties.class)
@Slf4j
public class TokenConfig {

    @Bean
    public FungibleLedgerRegistry fungibleLedgerRegistry(TokenProperties properties, TransitionExecutor transitions) {
        String custody = normalized(properties.getCustodyAddress());
        Set<String> tokens = new LinkedHashSet<>();
        tokens.add(normalized(properties.getGovernanceToken()));
        properties.getBalances().keySet().forEach(token -> tokens.add(normalized(token)));

        List<InMemoryFungibleLedger> ledgers = new ArrayList<>();
        for (String token : tokens) {
            InMemoryFungibleLedger ledger = new InMemoryFungibleLedger(token, custody, transitions);
            properties.getBalances().forEach((configuredToken, opening) -> {
                if (normalized(configuredToken).equals(token)) {
                    opening.forEach((account, amount) -> {
                        if (amount != null && amount.signum() > 0) {
                            ledger.mint(normalized(account), amount);
                        }
                    });
                }
            });
            ledgers.add(ledger);
        }
        log.info("Registered {} token ledger(s); governance token {}", ledgers.size(), properties.getGovernanceToken());
        return new FungibleLedgerRegistry(custody, properties.getGovernanceToken(), ledgers);
    }

    @Bean
    public InMemoryNativeBalanceLedger nativeBalanceLedger(TokenProperties properties, TransitionExecutor transitions) {
        InMemoryNativeBalanceLedger ledger = new InMemoryNativeBalanceLedger(transitions);
        properties.getNativeBalances().forEach((account, amount) -> {
            if (amount != null && amount.signum() > 0) {
                ledger.credit(normalized(account), amount);
            }
        });
        return ledger;
    }

    /**
     * Ledger stores key accounts by their lowercase form, the same form the API hands in.
     */
    static String normalized(String address) {
        return address.trim().toLowerCase(Locale.ROOT);
    }
}
