package com.foliovault.api.controller;

import com.foliovault.api.validation.AddressValidator;
import com.foliovault.governance.GovernanceModule;
import com.foliovault.governance.config.GovernanceProperties;
import com.foliovault.insurance.InsuranceModule;
import com.foliovault.portfolio.PortfolioRegistry;
import com.foliovault.portfolio.config.PortfolioProperties;
import com.foliovault.pricing.PriceOracleRegistry;
import com.foliovault.support.FixedPriceOracle;
import com.foliovault.support.LedgerFixture;
import com.foliovault.token.TokenAccountService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.validation.beanvalidation.LocalValidatorFactoryBean;

import java.time.Duration;
import java.util.List;

import static com.foliovault.support.LedgerFixture.ALICE;
import static com.foliovault.support.LedgerFixture.BOB;
import static com.foliovault.support.LedgerFixture.CAROL;
import static com.foliovault.support.LedgerFixture.CUSTODY;
import static com.foliovault.support.LedgerFixture.GOVERNANCE_TOKEN;
import static com.foliovault.support.LedgerFixture.big;

class GovernanceAndCoverageControllerTest {

    private static final String UNKNOWN_TOKEN = "0x000000000000000000000000000000000000dead";

    private LedgerFixture fx;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        fx = new LedgerFixture();
        fx.governanceToken.mint(CUSTODY, big(10_000));

        AddressValidator addressValidator = new AddressValidator();
        PriceOracleRegistry oracles = new PriceOracleRegistry(List.of(new FixedPriceOracle("test")));
        PortfolioRegistry portfolios = new PortfolioRegistry(fx.transitions, oracles, fx.tokens, new PortfolioProperties(), fx.clock);
        portfolios.initialize(ALICE);
        GovernanceProperties governanceProperties = new GovernanceProperties();
        governanceProperties.setAdminAddress(CAROL);
        GovernanceModule governance = new GovernanceModule(fx.transitions, fx.tokens, governanceProperties, fx.clock);
        InsuranceModule insurance = new InsuranceModule(fx.transitions, portfolios, fx.tokens, fx.clock);

        LocalValidatorFactoryBean validator = new LocalValidatorFactoryBean();
        validator.afterPropertiesSet();
        webTestClient = WebTestClient.bindToController(
                        new GovernanceController(addressValidator, governance, fx.clock),
                        new InsuranceController(addressValidator, insurance),
                        new PriceFeedController(addressValidator, portfolios, oracles),
                        new TokenController(addressValidator, new TokenAccountService(fx.tokens)))
                .controllerAdvice(new ValidationExceptionHandler(), new LedgerExceptionHandler())
                .validator(validator)
                .build();
    }

    @Nested
    @DisplayName("governance")
    class Governance {

        private void createProposal() {
            webTestClient.post().uri("/api/v1/governance/proposals")
                    .header(ApiHeaders.ACCOUNT, ALICE)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"description\":\"raise fees\",\"votingPeriodSeconds\":3600}")
                    .exchange()
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.id").isEqualTo(0)
                    .jsonPath("$.status").isEqualTo("OPEN");
        }

        @Test
        @DisplayName("votes accumulate while open, then the proposal closes with 409 VOTING_CLOSED")
        void voteUntilDeadline() {
            createProposal();

            webTestClient.post().uri("/api/v1/governance/proposals/0/votes")
                    .header(ApiHeaders.ACCOUNT, BOB)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"votes\":7}")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.voteCount").isEqualTo(7);

            fx.clock.advance(Duration.ofHours(1));

            webTestClient.post().uri("/api/v1/governance/proposals/0/votes")
                    .header(ApiHeaders.ACCOUNT, BOB)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"votes\":1}")
                    .exchange()
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("VOTING_CLOSED");

            webTestClient.get().uri("/api/v1/governance/proposals/0")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("CLOSED");

            webTestClient.get().uri("/api/v1/governance/summary")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.proposalCount").isEqualTo(1)
                    .jsonPath("$.totalVotes").isEqualTo(7);
        }

        @Test
        @DisplayName("unknown proposal: GET 404, vote 400 INVALID_ARGUMENT")
        void unknownProposal() {
            webTestClient.get().uri("/api/v1/governance/proposals/3")
                    .exchange()
                    .expectStatus().isNotFound();

            webTestClient.post().uri("/api/v1/governance/proposals/3/votes")
                    .header(ApiHeaders.ACCOUNT, BOB)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"votes\":1}")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("INVALID_ARGUMENT");
        }

        @Test
        @DisplayName("non-positive voting period fails validation")
        void invalidVotingPeriod() {
            webTestClient.post().uri("/api/v1/governance/proposals")
                    .header(ApiHeaders.ACCOUNT, ALICE)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"description\":\"raise fees\",\"votingPeriodSeconds\":0}")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");
        }
    }

    @Nested
    @DisplayName("insurance")
    class Insurance {

        private void buy(String account, long coverage, long premium) {
            webTestClient.post().uri("/api/v1/insurance/policies")
                    .header(ApiHeaders.ACCOUNT, account)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"coverageAmount\":" + coverage + ",\"premium\":" + premium + "}")
                    .exchange()
                    .expectStatus().isOk();
        }

        @Test
        @DisplayName("buy, claim once, second claim is 409 POLICY_INACTIVE")
        void buyAndClaim() {
            buy(ALICE, 1_000, 10);

            webTestClient.get().uri("/api/v1/insurance/policies/{account}", ALICE)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.active").isEqualTo(true)
                    .jsonPath("$.coverageAmount").isEqualTo(1000);

            webTestClient.post().uri("/api/v1/insurance/claims")
                    .header(ApiHeaders.ACCOUNT, ALICE)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.value").isEqualTo(1000);

            webTestClient.post().uri("/api/v1/insurance/claims")
                    .header(ApiHeaders.ACCOUNT, ALICE)
                    .exchange()
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("POLICY_INACTIVE");
        }

        @Test
        @DisplayName("premium other than one percent of coverage is 400, no portfolio is 403")
        void rejectedPurchases() {
            webTestClient.post().uri("/api/v1/insurance/policies")
                    .header(ApiHeaders.ACCOUNT, ALICE)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"coverageAmount\":1000,\"premium\":9}")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("INVALID_ARGUMENT");

            webTestClient.post().uri("/api/v1/insurance/policies")
                    .header(ApiHeaders.ACCOUNT, BOB)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"coverageAmount\":1000,\"premium\":10}")
                    .exchange()
                    .expectStatus().isForbidden();
        }
    }

    @Nested
    @DisplayName("price feeds and tokens")
    class FeedsAndTokens {

        @Test
        @DisplayName("a symbol binds once, rebinding is 409 ALREADY_BOUND")
        void bindOnce() {
            webTestClient.put().uri("/api/v1/price-feeds/ETH")
                    .header(ApiHeaders.ACCOUNT, BOB)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"source\":\"test\"}")
                    .exchange()
                    .expectStatus().isOk();

            webTestClient.put().uri("/api/v1/price-feeds/ETH")
                    .header(ApiHeaders.ACCOUNT, ALICE)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"source\":\"test\"}")
                    .exchange()
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("ALREADY_BOUND");

            webTestClient.get().uri("/api/v1/price-feeds/ETH")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.source").isEqualTo("test");

            webTestClient.get().uri("/api/v1/price-feeds")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$[0]").isEqualTo("test");
        }

        @Test
        @DisplayName("custody approval is visible as allowance, unknown token is 404")
        void approvals() {
            webTestClient.post().uri("/api/v1/tokens/{token}/approvals", GOVERNANCE_TOKEN)
                    .header(ApiHeaders.ACCOUNT, ALICE)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"amount\":250}")
                    .exchange()
                    .expectStatus().isNoContent();

            webTestClient.get().uri("/api/v1/tokens/{token}/allowances/{owner}", GOVERNANCE_TOKEN, ALICE)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.value").isEqualTo(250);

            webTestClient.get().uri("/api/v1/tokens/{token}/balances/{account}", UNKNOWN_TOKEN, ALICE)
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("UNKNOWN_TOKEN");
        }
    }
}
