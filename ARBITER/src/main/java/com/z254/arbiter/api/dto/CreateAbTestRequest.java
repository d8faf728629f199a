package com.z254.arbiter.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class CreateAbTestRequest {

    @NotBlank
    private String championVersion;

    @NotBlank
    private String candidateVersion;

    /** Share of traffic routed to the candidate, exclusive bounds */
    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax(value = "1.0", inclusive = false)
    private Double trafficSplit;
}
