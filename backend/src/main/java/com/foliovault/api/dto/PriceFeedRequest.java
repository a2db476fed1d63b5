package com.foliovault.api.dto;

import jakarta.validation.constraints.NotBlank;

public record PriceFeedRequest(@NotBlank String source) {
}
