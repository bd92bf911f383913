package com.quantsim.simulator.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.quantsim.simulator.domain.ExecutionTiming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for running a simulation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SimulationRequest {

    @NotBlank(message = "Strategy name is required")
    private String strategyName;

    @NotEmpty(message = "At least one asset is required")
    private List<@NotBlank(message = "Asset must not be blank") String> assets;

    @NotNull(message = "Start date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @NotNull(message = "End date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate endDate;

    @NotNull(message = "Initial capital is required")
    @Positive(message = "Initial capital must be positive")
    private BigDecimal initialCapital;

    @NotNull(message = "Market is required")
    private MarketPreset market;

    // overrides the preset's timing when set
    private ExecutionTiming executionTiming;

    @Builder.Default
    private String dataSource = "synthetic";

    private Map<String, Object> parameters;

    private List<@Valid IndicatorRequest> indicators;

    @JsonIgnore
    @AssertTrue(message = "End date must not be before start date")
    public boolean isDateRangeValid() {
        return startDate == null || endDate == null || !endDate.isBefore(startDate);
    }
}
