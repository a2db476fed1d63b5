package com.foliovault.api.controller;

import com.foliovault.api.dto.AmountRequest;
import com.foliovault.api.dto.ValueResponse;
import com.foliovault.api.validation.AddressValidator;
import com.foliovault.token.TokenAccountService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Balances and custody allowances on host-managed token ledgers.
 */
@RestController
@RequestMapping("/api/v1/tokens/{token}")
@RequiredArgsConstructor
public class TokenController {

    private final AddressValidator addressValidator;
    private final TokenAccountService tokenAccountService;

    @GetMapping("/balances/{account}")
    public ResponseEntity<ValueResponse> balance(@PathVariable String token, @PathVariable String account) {
        return ResponseEntity.ok(new ValueResponse(tokenAccountService.balanceOf(
                addressValidator.normalize(token, "token"), addressValidator.normalize(account, "account"))));
    }

    @GetMapping("/allowances/{owner}")
    public ResponseEntity<ValueResponse> custodyAllowance(@PathVariable String token, @PathVariable String owner) {
        return ResponseEntity.ok(new ValueResponse(tokenAccountService.custodyAllowance(
                addressValidator.normalize(token, "token"), addressValidator.normalize(owner, "owner"))));
    }

    @PostMapping("/approvals")
    public ResponseEntity<Void> approveCustody(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account,
                                               @PathVariable String token,
                                               @RequestBody @Valid AmountRequest request) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        tokenAccountService.approveCustody(addressValidator.normalize(token, "token"), caller, request.amount());
        return ResponseEntity.noContent().build();
    }
}
