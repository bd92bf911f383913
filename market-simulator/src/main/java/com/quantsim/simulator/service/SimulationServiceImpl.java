package com.quantsim.simulator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.quantsim.simulator.controller.dto.IndicatorRequest;
import com.quantsim.simulator.controller.dto.SimulationRequest;
import com.quantsim.simulator.controller.dto.SimulationResponse;
import com.quantsim.simulator.domain.EquitySnapshot;
import com.quantsim.simulator.domain.IndicatorSeries;
import com.quantsim.simulator.domain.MarketConfig;
import com.quantsim.simulator.domain.PerformanceReport;
import com.quantsim.simulator.domain.SimulationResult;
import com.quantsim.simulator.domain.Strategy;
import com.quantsim.simulator.domain.TradeRecord;
import com.quantsim.simulator.engine.SimulationKernel;
import com.quantsim.simulator.engine.StrategyRunResult;
import com.quantsim.simulator.exception.SimulationNotFoundException;
import com.quantsim.simulator.infrastructure.notification.Notifier;
import com.quantsim.simulator.repository.SimulationResultRepository;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Implementation of SimulationService.
 * Runs are deterministic, so an identical request returns the stored result instead of
 * simulating again.
 */
@Service
@Slf4j
public class SimulationServiceImpl implements SimulationService {

    private static final TypeReference<List<TradeRecord>> TRADE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<EquitySnapshot>> EQUITY_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Long>> HOLDINGS = new TypeReference<>() {
    };

    private final SimulationResultRepository simulationResultRepository;
    private final MarketDataService marketDataService;
    private final StrategyFactory strategyFactory;
    private final SimulationMetricsService metricsService;
    private final TradeLogExporter tradeLogExporter;
    private final Notifier notifier;
    private final ObjectMapper objectMapper;
    private final int lookbackDays;
    private final double riskFreeRate;
    private final String notificationRecipient;

    public SimulationServiceImpl(SimulationResultRepository simulationResultRepository,
                                 MarketDataService marketDataService,
                                 StrategyFactory strategyFactory,
                                 SimulationMetricsService metricsService,
                                 TradeLogExporter tradeLogExporter,
                                 Notifier notifier,
                                 ObjectMapper objectMapper,
                                 @Value("${simulator.lookback-days:365}") int lookbackDays,
                                 @Value("${simulator.risk-free-rate:0.0}") double riskFreeRate,
                                 @Value("${simulator.notification.recipient:}") String notificationRecipient) {
        this.simulationResultRepository = simulationResultRepository;
        this.marketDataService = marketDataService;
        this.strategyFactory = strategyFactory;
        this.metricsService = metricsService;
        this.tradeLogExporter = tradeLogExporter;
        this.notifier = notifier;
        this.objectMapper = objectMapper;
        this.lookbackDays = lookbackDays;
        this.riskFreeRate = riskFreeRate;
        this.notificationRecipient = notificationRecipient;
    }

    @Override
    @Transactional
    public SimulationResponse runSimulation(SimulationRequest request) {
        log.info("Received simulation for strategy: {}, assets: {}, market: {}",
                request.getStrategyName(), request.getAssets(), request.getMarket());

        String idempotencyKey = generateIdempotencyKey(request);
        Optional<SimulationResult> existing = simulationResultRepository.findByIdempotencyKey(idempotencyKey);
        if (existing.isPresent()) {
            log.info("Identical request already simulated as run {}. Returning stored results.",
                    existing.get().getId());
            return toResponse(existing.get(), true, "Simulation already run. Returning stored results.");
        }

        MDC.put("simulationRun", idempotencyKey.substring(0, 12));
        try {
            long startTime = System.currentTimeMillis();
            StrategyRunResult run;
            try {
                run = simulate(request);
            } catch (RuntimeException e) {
                log.error("Simulation failed: {}", e.getMessage());
                metricsService.recordRunFailed();
                throw e;
            }
            long executionTimeMs = System.currentTimeMillis() - startTime;

            SimulationResult saved = simulationResultRepository.save(
                    toEntity(request, idempotencyKey, run, executionTimeMs));
            metricsService.recordRunCompleted(executionTimeMs, run.getStats());

            log.info("Simulation {} completed in {} ms. {}", saved.getId(), executionTimeMs,
                    metricsService.getMetricsSummary());
            return toResponse(saved, false, "Simulation completed");
        } finally {
            MDC.remove("simulationRun");
        }
    }

    @Override
    @Transactional(readOnly = true)
    public SimulationResponse getSimulation(Long id) {
        SimulationResult result = simulationResultRepository.findById(id)
                .orElseThrow(() -> new SimulationNotFoundException(id));
        return toResponse(result, true, "Stored simulation");
    }

    @Override
    @Transactional(readOnly = true)
    public String exportTrades(Long id) {
        SimulationResult result = simulationResultRepository.findById(id)
                .orElseThrow(() -> new SimulationNotFoundException(id));
        return tradeLogExporter.toCsv(readJson(result.getTradesJson(), TRADE_LIST));
    }

    private StrategyRunResult simulate(SimulationRequest request) {
        MarketConfig marketConfig = request.getMarket().toMarketConfig();
        if (request.getExecutionTiming() != null) {
            marketConfig = marketConfig.toBuilder().executionTiming(request.getExecutionTiming()).build();
        }

        Strategy strategy = strategyFactory.createStrategy(request.getStrategyName(), request.getAssets(),
                request.getInitialCapital(), marketConfig, request.getDataSource(), request.getParameters());

        SimulationKernel kernel = SimulationKernel.builder()
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .lookbackDays(lookbackDays)
                .priceHistoryLoader(marketDataService)
                .notifier(notifier)
                .notificationRecipient(notificationRecipient)
                .riskFreeRate(riskFreeRate)
                .build();
        kernel.addStrategy(strategy);
        if (request.getIndicators() != null) {
            for (IndicatorRequest indicator : request.getIndicators()) {
                kernel.addIndicator(IndicatorSeries.builder()
                        .name(indicator.getName())
                        .asset(indicator.getAsset())
                        .source(indicator.getSource() != null ? indicator.getSource() : request.getDataSource())
                        .build());
            }
        }
        kernel.initialize();
        kernel.run();
        return kernel.finish().get(0);
    }

    private SimulationResult toEntity(SimulationRequest request, String idempotencyKey, StrategyRunResult run,
                                      long executionTimeMs) {
        PerformanceReport report = run.getReport();
        return SimulationResult.builder()
                .idempotencyKey(idempotencyKey)
                .strategyName(run.getStrategyName())
                .assets(String.join(",", request.getAssets()))
                .market(request.getMarket().name())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .initialCapital(run.getInitialCapital())
                .finalValue(report.getFinalValue())
                .finalCash(run.getFinalCash())
                .totalReturn(report.getTotalReturn())
                .cagr(report.getCagr())
                .volatility(report.getVolatility())
                .sharpeRatio(report.getSharpeRatio())
                .sortinoRatio(report.getSortinoRatio())
                .maxDrawdown(report.getMaxDrawdown())
                .winRate(report.getWinRate())
                .totalTrades(report.getTotalTrades())
                .totalCost(report.getTotalCost())
                .totalSlippage(report.getTotalSlippage())
                .executionTimeMs(executionTimeMs)
                .tradesJson(writeJson(run.getTrades()))
                .equityCurveJson(writeJson(run.getEquityCurve()))
                .holdingsJson(writeJson(run.getHoldings()))
                .build();
    }

    private SimulationResponse toResponse(SimulationResult result, boolean isExisting, String message) {
        return SimulationResponse.builder()
                .id(result.getId())
                .strategyName(result.getStrategyName())
                .assets(Arrays.asList(result.getAssets().split(",")))
                .market(result.getMarket())
                .startDate(result.getStartDate())
                .endDate(result.getEndDate())
                .message(message)
                .isExisting(isExisting)
                .initialCapital(result.getInitialCapital())
                .finalValue(result.getFinalValue())
                .finalCash(result.getFinalCash())
                .holdings(readJson(result.getHoldingsJson(), HOLDINGS))
                .totalReturn(result.getTotalReturn())
                .cagr(result.getCagr())
                .volatility(result.getVolatility())
                .sharpeRatio(result.getSharpeRatio())
                .sortinoRatio(result.getSortinoRatio())
                .maxDrawdown(result.getMaxDrawdown())
                .winRate(result.getWinRate())
                .totalTrades(result.getTotalTrades())
                .totalCost(result.getTotalCost())
                .totalSlippage(result.getTotalSlippage())
                .executionTimeMs(result.getExecutionTimeMs())
                .trades(readJson(result.getTradesJson(), TRADE_LIST))
                .equityCurve(readJson(result.getEquityCurveJson(), EQUITY_LIST))
                .build();
    }

    /**
     * Generate SHA-256 hash of the request payload for idempotency.
     */
    private String generateIdempotencyKey(SimulationRequest request) {
        try {
            String jsonPayload = objectMapper.copy()
                    .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                    .writeValueAsString(request);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(jsonPayload.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to generate idempotency key", e);
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize simulation output", e);
        }
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored simulation output is unreadable", e);
        }
    }
}
