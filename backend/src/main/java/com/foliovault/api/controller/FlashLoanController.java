package com.foliovault.api.controller;

import com.foliovault.api.dto.AmountRequest;
import com.foliovault.api.dto.FlashLoanResponse;
import com.foliovault.api.dto.ValueResponse;
import com.foliovault.api.validation.AddressValidator;
import com.foliovault.flashloan.FlashLoanEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * Flash loans over HTTP run without a receiver callback: the borrower's existing native balance must already
 * cover the fee.
 */
@RestController
@RequestMapping("/api/v1/flash-loans")
@RequiredArgsConstructor
public class FlashLoanController {

    private final AddressValidator addressValidator;
    private final FlashLoanEngine flashLoanEngine;

    @PostMapping
    public ResponseEntity<FlashLoanResponse> borrow(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account,
                                                    @RequestBody @Valid AmountRequest request) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        return ResponseEntity.ok(FlashLoanResponse.from(flashLoanEngine.borrow(caller, request.amount())));
    }

    @GetMapping("/liquidity")
    public ResponseEntity<ValueResponse> liquidity() {
        return ResponseEntity.ok(new ValueResponse(flashLoanEngine.availableLiquidity()));
    }

    @GetMapping("/fee")
    public ResponseEntity<ValueResponse> fee(@RequestParam BigInteger amount) {
        return ResponseEntity.ok(new ValueResponse(flashLoanEngine.fee(amount)));
    }
}
