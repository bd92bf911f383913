package com.quantsim.simulator.controller.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Indicator series to load for a simulation. Without a source, the request's data source is used.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IndicatorRequest {

    @NotBlank(message = "Indicator name is required")
    private String name;

    @NotBlank(message = "Indicator asset is required")
    private String asset;

    private String source;
}
