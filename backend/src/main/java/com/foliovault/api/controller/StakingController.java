package com.foliovault.api.controller;

import com.foliovault.api.dto.AmountRequest;
import com.foliovault.api.dto.StakeResponse;
import com.foliovault.api.dto.ValueResponse;
import com.foliovault.api.validation.AddressValidator;
import com.foliovault.domain.StakeInfo;
import com.foliovault.staking.StakingLedger;
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
 * Governance-token staking. Staking pulls from the caller, so a custody allowance must be granted first
 * (POST /api/v1/tokens/{token}/approvals).
 */
@RestController
@RequestMapping("/api/v1/staking")
@RequiredArgsConstructor
public class StakingController {

    private final AddressValidator addressValidator;
    private final StakingLedger stakingLedger;

    @PostMapping("/stake")
    public ResponseEntity<StakeResponse> stake(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account,
                                               @RequestBody @Valid AmountRequest request) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        return ResponseEntity.ok(toResponse(caller, stakingLedger.stake(caller, request.amount())));
    }

    @PostMapping("/unstake")
    public ResponseEntity<StakeResponse> unstake(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account,
                                                 @RequestBody @Valid AmountRequest request) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        return ResponseEntity.ok(toResponse(caller, stakingLedger.unstake(caller, request.amount())));
    }

    @PostMapping("/claims")
    public ResponseEntity<ValueResponse> claimRewards(@RequestHeader(value = ApiHeaders.ACCOUNT, required = false) String account) {
        String caller = addressValidator.normalize(account, ApiHeaders.ACCOUNT);
        return ResponseEntity.ok(new ValueResponse(stakingLedger.claimRewards(caller)));
    }

    @GetMapping("/total")
    public ResponseEntity<ValueResponse> totalStaked() {
        return ResponseEntity.ok(new ValueResponse(stakingLedger.totalStaked()));
    }

    @GetMapping("/{account}")
    public ResponseEntity<StakeResponse> getStake(@PathVariable String account) {
        String normalized = addressValidator.normalize(account, "account");
        StakeInfo info = stakingLedger.findStake(normalized).orElseGet(StakeInfo::new);
        return ResponseEntity.ok(toResponse(normalized, info));
    }

    private StakeResponse toResponse(String account, StakeInfo info) {
        return new StakeResponse(account, info.getAmount(), info.getLastStakeTime(), stakingLedger.pendingReward(account));
    }
}
