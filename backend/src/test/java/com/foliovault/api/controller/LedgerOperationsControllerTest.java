package com.foliovault.api.controller;

import com.foliovault.api.validation.AddressValidator;
import com.foliovault.flashloan.FlashLoanEngine;
import com.foliovault.flashloan.config.FlashLoanProperties;
import com.foliovault.referral.ReferralRegistry;
import com.foliovault.staking.StakingLedger;
import com.foliovault.staking.config.StakingProperties;
import com.foliovault.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.validation.beanvalidation.LocalValidatorFactoryBean;

import static com.foliovault.support.LedgerFixture.ALICE;
import static com.foliovault.support.LedgerFixture.BOB;
import static com.foliovault.support.LedgerFixture.CAROL;
import static com.foliovault.support.LedgerFixture.CUSTODY;
import static com.foliovault.support.LedgerFixture.big;

class LedgerOperationsControllerTest {

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        LedgerFixture fx = new LedgerFixture();
        fx.governanceToken.mint(ALICE, big(1_000));
        fx.governanceToken.mint(CUSTODY, big(10_000));
        fx.governanceToken.approve(ALICE, CUSTODY, big(1_000));
        fx.nativeLedger.credit(CUSTODY, big(1_000));

        AddressValidator addressValidator = new AddressValidator();
        StakingLedger staking = new StakingLedger(fx.transitions, fx.tokens, new StakingProperties(), fx.clock);
        FlashLoanEngine flashLoans = new FlashLoanEngine(fx.transitions, fx.nativeLedger, fx.tokens, new FlashLoanProperties());
        ReferralRegistry referrals = new ReferralRegistry(fx.transitions);

        LocalValidatorFactoryBean validator = new LocalValidatorFactoryBean();
        validator.afterPropertiesSet();
        webTestClient = WebTestClient.bindToController(
                        new StakingController(addressValidator, staking),
                        new FlashLoanController(addressValidator, flashLoans),
                        new ReferralController(addressValidator, referrals))
                .controllerAdvice(new ValidationExceptionHandler(), new LedgerExceptionHandler())
                .validator(validator)
                .build();
    }

    @Test
    @DisplayName("stake then read back the position and the total")
    void stakeAndRead() {
        webTestClient.post().uri("/api/v1/staking/stake")
                .header(ApiHeaders.ACCOUNT, ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"amount\":400}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.account").isEqualTo(ALICE)
                .jsonPath("$.amount").isEqualTo(400)
                .jsonPath("$.pendingReward").isEqualTo(0);

        webTestClient.get().uri("/api/v1/staking/total")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.value").isEqualTo(400);
    }

    @Test
    @DisplayName("unstaking more than staked returns 422 INSUFFICIENT_STAKE")
    void unstakeTooMuch() {
        webTestClient.post().uri("/api/v1/staking/unstake")
                .header(ApiHeaders.ACCOUNT, BOB)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"amount\":1}")
                .exchange()
                .expectStatus().isEqualTo(422)
                .expectBody()
                .jsonPath("$.error").isEqualTo("INSUFFICIENT_STAKE");
    }

    @Test
    @DisplayName("zero-fee flash loan is verified, a loan the borrower cannot cover is rolled back")
    void flashLoans() {
        webTestClient.post().uri("/api/v1/flash-loans")
                .header(ApiHeaders.ACCOUNT, BOB)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"amount\":10}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.borrower").isEqualTo(BOB)
                .jsonPath("$.fee").isEqualTo(0)
                .jsonPath("$.phase").isEqualTo("REPAYMENT_VERIFIED");

        webTestClient.post().uri("/api/v1/flash-loans")
                .header(ApiHeaders.ACCOUNT, CAROL)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"amount\":100}")
                .exchange()
                .expectStatus().isEqualTo(422)
                .expectBody()
                .jsonPath("$.error").isEqualTo("REPAYMENT_FAILED");

        webTestClient.get().uri("/api/v1/flash-loans/liquidity")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.value").isEqualTo(990);
    }

    @Test
    @DisplayName("flash loan fee is 5% of the amount")
    void fee() {
        webTestClient.get().uri("/api/v1/flash-loans/fee?amount=200")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.value").isEqualTo(10);
    }

    @Test
    @DisplayName("referral returns 201, repeat returns 409, lookup returns the referrer")
    void referrals() {
        webTestClient.post().uri("/api/v1/referrals")
                .header(ApiHeaders.ACCOUNT, ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"newUser\":\"" + BOB + "\"}")
                .exchange()
                .expectStatus().isCreated();

        webTestClient.post().uri("/api/v1/referrals")
                .header(ApiHeaders.ACCOUNT, ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"newUser\":\"" + BOB + "\"}")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("ALREADY_EXISTS");

        webTestClient.get().uri("/api/v1/referrals/{account}", BOB)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.referrer").isEqualTo(ALICE);
    }

    @Test
    @DisplayName("malformed address in a body fails validation with INVALID_ADDRESS")
    void invalidBodyAddress() {
        webTestClient.post().uri("/api/v1/referrals")
                .header(ApiHeaders.ACCOUNT, ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"newUser\":\"0x12\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ADDRESS");
    }
}
