package com.foliovault.api.controller;

import com.foliovault.api.dto.BuyInsuranceRequest;
import com.foliovault.api.dto.InsurancePolicyResponse;
import com.foliovault.api.dto.ValueResponse;
import com.foliovault.api.validation.AddressValidator;
import com.foliovault.insurance.InsuranceModule;
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

@RestController
@RequestMapping("/api/v1/insurance")
@RequiredArgsConstructor
public class InsuranceController {

    private final AddressValidator addressValidator;
    private final InsuranceModule insuranceModule;

    @PostMapping("/policies")
    public ResponseEntity<InsurancePolicyResponse> buy(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account,
                                                       @RequestBody @Valid BuyInsuranceRequest request) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        return ResponseEntity.ok(InsurancePolicyResponse.from(caller,
                insuranceModule.buyInsurance(caller, request.coverageAmount(), request.premium())));
    }

    @PostMapping("/claims")
    public ResponseEntity<ValueResponse> claim(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        return ResponseEntity.ok(new ValueResponse(insuranceModule.claimInsurance(caller)));
    }

    @GetMapping("/policies/{account}")
    public ResponseEntity<InsurancePolicyResponse> getPolicy(@PathVariable String account) {
        String normalized = addressValidator.normalize(account, "account");
        return insuranceModule.findPolicy(normalized)
                .map(p -> ResponseEntity.ok(InsurancePolicyResponse.from(normalized, p)))
                .orElse(ResponseEntity.notFound().build());
    }
}
