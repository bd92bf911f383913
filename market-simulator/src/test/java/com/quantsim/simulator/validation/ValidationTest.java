package com.quantsim.simulator.validation;

import com.quantsim.simulator.controller.dto.IndicatorRequest;
import com.quantsim.simulator.controller.dto.MarketPreset;
import com.quantsim.simulator.controller.dto.SimulationRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for input validation and constraint violations.
 */
class ValidationTest {

    private static Validator validator;

    @BeforeAll
    static void setUp() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @Test
    void testValidRequest_NoViolations() {
        // Arrange
        SimulationRequest request = createValidRequest();

        // Act
        Set<ConstraintViolation<SimulationRequest>> violations = validator.validate(request);

        // Assert
        assertTrue(violations.isEmpty(), "Valid request should have no violations");
    }

    @Test
    void testMissingStrategyName_Violation() {
        // Arrange
        SimulationRequest request = createValidRequest();
        request.setStrategyName(null);

        // Act
        Set<ConstraintViolation<SimulationRequest>> violations = validator.validate(request);

        // Assert
        assertEquals(1, violations.size());
        ConstraintViolation<SimulationRequest> violation = violations.iterator().next();
        assertEquals("strategyName", violation.getPropertyPath().toString());
        assertTrue(violation.getMessage().contains("required"));
    }

    @Test
    void testBlankStrategyName_Violation() {
        SimulationRequest request = createValidRequest();
        request.setStrategyName("   ");

        assertEquals(Set.of("strategyName"), violatedPaths(request));
    }

    @Test
    void testEmptyAssets_Violation() {
        SimulationRequest request = createValidRequest();
        request.setAssets(Collections.emptyList());

        assertEquals(Set.of("assets"), violatedPaths(request));
    }

    @Test
    void testBlankAssetInList_Violation() {
        // Arrange
        SimulationRequest request = createValidRequest();
        request.setAssets(Arrays.asList("AAPL", " "));

        // Act
        Set<ConstraintViolation<SimulationRequest>> violations = validator.validate(request);

        // Assert
        assertEquals(1, violations.size());
        assertTrue(violations.iterator().next().getPropertyPath().toString().startsWith("assets["));
    }

    @Test
    void testMissingDates_Violation() {
        SimulationRequest request = createValidRequest();
        request.setStartDate(null);
        request.setEndDate(null);

        assertEquals(Set.of("startDate", "endDate"), violatedPaths(request));
    }

    @Test
    void testEndBeforeStart_Violation() {
        // Arrange
        SimulationRequest request = createValidRequest();
        request.setEndDate(request.getStartDate().minusDays(1));

        // Act
        Set<ConstraintViolation<SimulationRequest>> violations = validator.validate(request);

        // Assert
        assertEquals(1, violations.size());
        assertEquals("End date must not be before start date", violations.iterator().next().getMessage());
    }

    @Test
    void testSingleDayRange_Valid() {
        SimulationRequest request = createValidRequest();
        request.setEndDate(request.getStartDate());

        assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    void testNullInitialCapital_Violation() {
        SimulationRequest request = createValidRequest();
        request.setInitialCapital(null);

        assertEquals(Set.of("initialCapital"), violatedPaths(request));
    }

    @Test
    void testNonPositiveInitialCapital_Violation() {
        for (String capital : List.of("0", "-1000.00")) {
            SimulationRequest request = createValidRequest();
            request.setInitialCapital(new BigDecimal(capital));

            Set<ConstraintViolation<SimulationRequest>> violations = validator.validate(request);

            assertEquals(1, violations.size(), "Capital " + capital + " should be rejected");
            assertTrue(violations.iterator().next().getMessage().contains("positive"));
        }
    }

    @Test
    void testMissingMarket_Violation() {
        SimulationRequest request = createValidRequest();
        request.setMarket(null);

        assertEquals(Set.of("market"), violatedPaths(request));
    }

    @Test
    void testOptionalFields_Valid() {
        SimulationRequest request = createValidRequest();
        request.setParameters(null);
        request.setExecutionTiming(null);

        assertTrue(validator.validate(request).isEmpty());
        assertEquals("synthetic", request.getDataSource());
    }

    @Test
    void testIndicatorWithoutAsset_Violation() {
        SimulationRequest request = createValidRequest();
        request.setIndicators(List.of(
                IndicatorRequest.builder().name("oil").asset("CL").build(),
                IndicatorRequest.builder().name("us_debt").asset(" ").build()));

        assertEquals(Set.of("indicators[1].asset"), violatedPaths(request));
    }

    @Test
    void testMultipleViolations() {
        SimulationRequest request = new SimulationRequest();
        request.setAssets(new ArrayList<>());

        Set<String> paths = violatedPaths(request);

        assertEquals(Set.of("strategyName", "assets", "startDate", "endDate", "initialCapital", "market"), paths);
    }

    private Set<String> violatedPaths(SimulationRequest request) {
        return validator.validate(request).stream()
                .map(violation -> violation.getPropertyPath().toString())
                .collect(Collectors.toSet());
    }

    private SimulationRequest createValidRequest() {
        return SimulationRequest.builder()
                .strategyName("MovingAverageCrossover")
                .assets(List.of("AAPL", "MSFT"))
                .startDate(LocalDate.of(2023, 1, 1))
                .endDate(LocalDate.of(2023, 12, 31))
                .initialCapital(new BigDecimal("10000.00"))
                .market(MarketPreset.US)
                .parameters(Map.of("shortPeriod", 10, "longPeriod", 50))
                .build();
    }
}
