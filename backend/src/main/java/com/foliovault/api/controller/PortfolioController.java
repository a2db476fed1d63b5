package com.foliovault.api.controller;

import com.foliovault.api.dto.AddAssetRequest;
import com.foliovault.api.dto.AssetResponse;
import com.foliovault.api.dto.DynamicFeesRequest;
import com.foliovault.api.dto.EmergencyWithdrawRequest;
import com.foliovault.api.dto.FeeRatesRequest;
import com.foliovault.api.dto.PortfolioResponse;
import com.foliovault.api.dto.RebalanceRequest;
import com.foliovault.api.dto.RiskCheckResponse;
import com.foliovault.api.dto.RiskThresholdsRequest;
import com.foliovault.api.dto.ValueResponse;
import com.foliovault.api.dto.WithdrawRequest;
import com.foliovault.api.validation.AddressValidator;
import com.foliovault.domain.Portfolio;
import com.foliovault.portfolio.FeeCharge;
import com.foliovault.portfolio.PortfolioRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigInteger;
import java.util.List;

/**
 * Portfolio lifecycle. {@code /me} routes act on the portfolio of the X-Account caller.
 */
@RestController
@RequestMapping("/api/v1/portfolios")
@RequiredArgsConstructor
public class PortfolioController {

    private final AddressValidator addressValidator;
    private final PortfolioRegistry portfolioRegistry;

    @PostMapping
    public ResponseEntity<PortfolioResponse> initialize(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        return ResponseEntity.status(HttpStatus.CREATED).body(PortfolioResponse.from(portfolioRegistry.initialize(caller)));
    }

    @GetMapping("/{owner}")
    public ResponseEntity<PortfolioResponse> getPortfolio(@PathVariable String owner) {
        String normalized = addressValidator.normalize(owner, "owner");
        return portfolioRegistry.findPortfolio(normalized)
                .map(p -> ResponseEntity.ok(PortfolioResponse.from(p)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/me/assets")
    public ResponseEntity<AssetResponse> addAsset(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account,
                                                  @RequestBody @Valid AddAssetRequest request) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(AssetResponse.from(portfolioRegistry.addAsset(caller, request.symbol(), request.amount(), request.value())));
    }

    /**
     * Oracle sources call out over the network and block, so the refresh runs on the bounded elastic pool
     * instead of the event loop.
     */
    @PostMapping("/me/assets/{symbol}/refresh")
    public Mono<ResponseEntity<ValueResponse>> refreshAssetValue(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account,
                                                                 @PathVariable String symbol) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        return Mono.fromCallable(() -> ResponseEntity.ok(new ValueResponse(portfolioRegistry.refreshAssetValue(caller, symbol))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/me/withdrawals")
    public ResponseEntity<ValueResponse> withdraw(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account,
                                                  @RequestBody @Valid WithdrawRequest request) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        BigInteger removed = portfolioRegistry.withdraw(caller,
                addressValidator.normalize(request.tokenAddress(), "tokenAddress"),
                addressValidator.normalize(request.to(), "to"),
                request.symbol(),
                request.amount());
        return ResponseEntity.ok(new ValueResponse(removed));
    }

    @PostMapping("/me/emergency-withdrawals")
    public ResponseEntity<List<BigInteger>> emergencyWithdrawAll(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account,
                                                                 @RequestBody @Valid EmergencyWithdrawRequest request) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        List<String> tokens = request.tokenAddresses().stream()
                .map(t -> addressValidator.normalize(t, "tokenAddresses"))
                .toList();
        return ResponseEntity.ok(portfolioRegistry.emergencyWithdrawAll(caller, tokens));
    }

    @PostMapping("/me/rebalance")
    public ResponseEntity<Void> rebalance(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account,
                                          @RequestBody @Valid RebalanceRequest request) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        portfolioRegistry.rebalance(caller, request.symbols(), request.targetRatios());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/me/risk")
    public ResponseEntity<RiskCheckResponse> checkRisk(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        boolean within = portfolioRegistry.checkRisk(caller);
        BigInteger totalValue = portfolioRegistry.findPortfolio(caller).map(Portfolio::getTotalValue).orElse(BigInteger.ZERO);
        return ResponseEntity.ok(new RiskCheckResponse(within, totalValue));
    }

    @PostMapping("/me/fees")
    public ResponseEntity<FeeCharge> applyDynamicFees(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account,
                                                      @RequestBody @Valid DynamicFeesRequest request) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        return ResponseEntity.ok(portfolioRegistry.applyDynamicFees(caller, request.bonusThreshold()));
    }

    @PutMapping("/me/fee-rates")
    public ResponseEntity<Void> setFeeRates(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account,
                                            @RequestBody @Valid FeeRatesRequest request) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        portfolioRegistry.setFeeRates(caller, request.managementFee(), request.performanceFee());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/me/risk-thresholds")
    public ResponseEntity<Void> setRiskThresholds(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account,
                                                  @RequestBody @Valid RiskThresholdsRequest request) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        portfolioRegistry.setRiskThresholds(caller, request.minValue(), request.maxValue());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/me/snapshots")
    public ResponseEntity<ValueResponse> recordValueSnapshot(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        return ResponseEntity.ok(new ValueResponse(portfolioRegistry.recordValueSnapshot(caller)));
    }
}
