package com.foliovault.api.controller;

import com.foliovault.api.dto.ReferralRequest;
import com.foliovault.api.dto.ReferralResponse;
import com.foliovault.api.validation.AddressValidator;
import com.foliovault.referral.ReferralRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/referrals")
@RequiredArgsConstructor
public class ReferralController {

    private final AddressValidator addressValidator;
    private final ReferralRegistry referralRegistry;

    @PostMapping
    public ResponseEntity<ReferralResponse> refer(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account,
                                                  @RequestBody @Valid ReferralRequest request) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        String newUser = addressValidator.normalize(request.newUser(), "newUser");
        referralRegistry.refer(caller, newUser);
        return ResponseEntity.status(HttpStatus.CREATED).body(new ReferralResponse(newUser, caller));
    }

    @GetMapping("/{account}")
    public ResponseEntity<ReferralResponse> getReferrer(@PathVariable String account) {
        String normalized = addressValidator.normalize(account, "account");
        return referralRegistry.findReferrer(normalized)
                .map(r -> ResponseEntity.ok(new ReferralResponse(normalized, r)))
                .orElse(ResponseEntity.notFound().build());
    }
}
