package com.foliovault.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record CreateProposalRequest(
        @NotBlank String description,
        @Positive long votingPeriodSeconds
) {
}
