package com.foliovault.api.controller;

import com.foliovault.api.dto.PriceFeedRequest;
import com.foliovault.api.dto.PriceFeedResponse;
import com.foliovault.api.validation.AddressValidator;
import com.foliovault.portfolio.PortfolioRegistry;
import com.foliovault.pricing.PriceOracleRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;

/**
 * Symbol -> oracle source bindings. Binding is one-time and open to any caller.
 */
@RestController
@RequestMapping("/api/v1/price-feeds")
@RequiredArgsConstructor
public class PriceFeedController {

    private final AddressValidator addressValidator;
    private final PortfolioRegistry portfolioRegistry;
    private final PriceOracleRegistry priceOracleRegistry;

    @PutMapping("/{symbol}")
    public ResponseEntity<PriceFeedResponse> bind(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account,
                                                  @PathVariable String symbol,
                                                  @RequestBody @Valid PriceFeedRequest request) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        portfolioRegistry.setPriceFeedSource(caller, symbol, request.source());
        return ResponseEntity.ok(new PriceFeedResponse(symbol, request.source()));
    }

    @GetMapping("/{symbol}")
    public ResponseEntity<PriceFeedResponse> get(@PathVariable String symbol) {
        return portfolioRegistry.findPriceFeedSource(symbol)
                .map(source -> ResponseEntity.ok(new PriceFeedResponse(symbol, source)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public ResponseEntity<Set<String>> sources() {
        return ResponseEntity.ok(priceOracleRegistry.sourceIds());
    }
}
