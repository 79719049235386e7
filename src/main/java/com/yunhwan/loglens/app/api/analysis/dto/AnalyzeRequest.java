package com.yunhwan.loglens.app.api.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record AnalyzeRequest(
        @NotBlank(message = "description cannot be empty") String description,
        @NotBlank(message = "timestamp is required") String timestamp,
        @NotBlank(message = "customer_id cannot be empty") @JsonProperty("customer_id") String customerId
) {
}
