package com.quantsim.simulator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantsim.simulator.domain.BuyAndHoldStrategy;
import com.quantsim.simulator.domain.MarketConfig;
import com.quantsim.simulator.domain.MovingAverageCrossoverStrategy;
import com.quantsim.simulator.domain.Strategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Factory for creating strategy instances based on name and parameters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StrategyFactory {

    private final ObjectMapper objectMapper;

    /**
     * Create a strategy instance from its name and parameters.
     *
     * @throws IllegalArgumentException for an unknown name or invalid parameters
     */
    public Strategy createStrategy(String strategyName, List<String> assets, BigDecimal initialCapital,
                                   MarketConfig marketConfig, String dataSource, Map<String, Object> parameters) {
        log.info("Creating strategy: {} for {} with parameters: {}", strategyName, assets, parameters);

        JsonNode params = objectMapper.valueToTree(parameters != null ? parameters : Map.of());

        return switch (strategyName.toLowerCase()) {
            case "buyandhold", "buy_and_hold" -> {
                BigDecimal entryDiscount = params.hasNonNull("entryDiscount")
                        ? new BigDecimal(params.get("entryDiscount").asText()) : BigDecimal.ZERO;
                int promiseDays = params.hasNonNull("promiseDays") ? params.get("promiseDays").asInt(5) : 5;
                yield new BuyAndHoldStrategy(assets, initialCapital, marketConfig, entryDiscount, promiseDays,
                        dataSource);
            }

            case "movingaveragecrossover", "ma_crossover" -> {
                int shortPeriod = params.hasNonNull("shortPeriod") ? params.get("shortPeriod").asInt(10) : 10;
                int longPeriod = params.hasNonNull("longPeriod") ? params.get("longPeriod").asInt(50) : 50;
                String riskIndicator = params.hasNonNull("riskIndicator") ? params.get("riskIndicator").asText() : null;
                BigDecimal riskThreshold = params.hasNonNull("riskThreshold")
                        ? new BigDecimal(params.get("riskThreshold").asText()) : null;
                yield new MovingAverageCrossoverStrategy(assets, shortPeriod, longPeriod, initialCapital,
                        marketConfig, dataSource, riskIndicator, riskThreshold);
            }

            default -> throw new IllegalArgumentException("Unknown strategy: " + strategyName);
        };
    }
}
