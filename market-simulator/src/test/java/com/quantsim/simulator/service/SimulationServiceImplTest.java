package com.quantsim.simulator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantsim.simulator.controller.dto.IndicatorRequest;
import com.quantsim.simulator.controller.dto.MarketPreset;
import com.quantsim.simulator.controller.dto.SimulationRequest;
import com.quantsim.simulator.controller.dto.SimulationResponse;
import com.quantsim.simulator.domain.BuyAndHoldStrategy;
import com.quantsim.simulator.domain.ExecutionTiming;
import com.quantsim.simulator.domain.MarketConfig;
import com.quantsim.simulator.domain.PriceBar;
import com.quantsim.simulator.domain.SimulationResult;
import com.quantsim.simulator.exception.SimulationNotFoundException;
import com.quantsim.simulator.exception.SourceFetchException;
import com.quantsim.simulator.infrastructure.notification.Notifier;
import com.quantsim.simulator.repository.SimulationResultRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.quantsim.simulator.marketdata.StaticPriceProvider.bar;
import static com.quantsim.simulator.marketdata.StaticPriceProvider.storeOf;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SimulationServiceImpl.
 */
@ExtendWith(MockitoExtension.class)
class SimulationServiceImplTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 2);
    private static final LocalDate END = LocalDate.of(2024, 1, 4);

    @Mock
    private SimulationResultRepository simulationResultRepository;

    @Mock
    private MarketDataService marketDataService;

    @Mock
    private StrategyFactory strategyFactory;

    @Mock
    private Notifier notifier;

    private SimpleMeterRegistry meterRegistry;
    private SimulationServiceImpl simulationService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        simulationService = new SimulationServiceImpl(simulationResultRepository, marketDataService,
                strategyFactory, new SimulationMetricsService(meterRegistry), new TradeLogExporter(), notifier,
                objectMapper, 0, 0.0, "");
    }

    @Test
    void testRunSimulation_NewRequest() {
        // Arrange
        SimulationRequest request = createRequest("AAPL");
        when(simulationResultRepository.findByIdempotencyKey(anyString())).thenReturn(Optional.empty());
        when(strategyFactory.createStrategy(eq("BuyAndHold"), eq(List.of("AAPL")), any(), any(), eq("synthetic"),
                any())).thenAnswer(invocation -> new BuyAndHoldStrategy(List.of("AAPL"),
                invocation.getArgument(2), invocation.getArgument(3)));
        List<PriceBar> bars = List.of(bar(START, "100"), bar(START.plusDays(1), "110"), bar(END, "120"));
        when(marketDataService.load("AAPL", "synthetic", START, END)).thenReturn(storeOf("AAPL", bars));
        when(simulationResultRepository.save(any(SimulationResult.class))).thenAnswer(invocation -> {
            SimulationResult result = invocation.getArgument(0);
            result.setId(7L);
            return result;
        });

        // Act
        SimulationResponse response = simulationService.runSimulation(request);

        // Assert
        assertEquals(7L, response.getId());
        assertFalse(response.getIsExisting());
        assertEquals("Simulation completed", response.getMessage());
        assertEquals(List.of("AAPL"), response.getAssets());
        assertEquals(1, response.getTotalTrades());
        assertEquals(Map.of("AAPL", 99L), response.getHoldings());
        assertEquals(3, response.getEquityCurve().size());
        assertTrue(response.getTotalReturn().signum() > 0);
        assertEquals(1.0, meterRegistry.counter("simulation.runs.completed").count());
        assertEquals(1.0, meterRegistry.counter("simulation.fills").count());
    }

    @Test
    void testRunSimulation_LoadsRequestedIndicators() {
        // Arrange
        SimulationRequest request = createRequest("AAPL");
        request.setIndicators(List.of(
                IndicatorRequest.builder().name("oil").asset("CL").build(),
                IndicatorRequest.builder().name("us_debt").asset("TNX").source("csv").build()));
        when(simulationResultRepository.findByIdempotencyKey(anyString())).thenReturn(Optional.empty());
        when(strategyFactory.createStrategy(any(), any(), any(), any(), any(), any()))
                .thenAnswer(invocation -> new BuyAndHoldStrategy(List.of("AAPL"),
                        invocation.getArgument(2), invocation.getArgument(3)));
        List<PriceBar> bars = List.of(bar(START, "100"), bar(START.plusDays(1), "110"), bar(END, "120"));
        when(marketDataService.load("AAPL", "synthetic", START, END)).thenReturn(storeOf("AAPL", bars));
        when(marketDataService.load("CL", "synthetic", START, END)).thenReturn(storeOf("CL", bars));
        when(marketDataService.load("TNX", "csv", START, END)).thenReturn(storeOf("TNX", bars));
        when(simulationResultRepository.save(any(SimulationResult.class))).thenAnswer(invocation -> {
            SimulationResult result = invocation.getArgument(0);
            result.setId(8L);
            return result;
        });

        // Act
        SimulationResponse response = simulationService.runSimulation(request);

        // Assert
        assertEquals(8L, response.getId());
        verify(marketDataService).load("CL", "synthetic", START, END);
        verify(marketDataService).load("TNX", "csv", START, END);
    }

    @Test
    void testRunSimulation_ExecutionTimingOverridesPreset() {
        // Arrange
        SimulationRequest request = createRequest("AAPL");
        request.setExecutionTiming(ExecutionTiming.NEXT_BAR_OPEN);
        when(simulationResultRepository.findByIdempotencyKey(anyString())).thenReturn(Optional.empty());
        ArgumentCaptor<MarketConfig> config = ArgumentCaptor.forClass(MarketConfig.class);
        when(strategyFactory.createStrategy(any(), any(), any(), config.capture(), any(), any()))
                .thenThrow(new IllegalArgumentException("stop here"));

        // Act
        assertThrows(IllegalArgumentException.class, () -> simulationService.runSimulation(request));

        // Assert
        assertEquals(ExecutionTiming.NEXT_BAR_OPEN, config.getValue().getExecutionTiming());
        assertEquals(MarketConfig.usMarket().getSlippageRate(), config.getValue().getSlippageRate());
    }

    @Test
    void testRunSimulation_IdempotentRequest() {
        // Arrange
        SimulationRequest request = createRequest("AAPL");
        SimulationResult stored = SimulationResult.builder()
                .id(3L)
                .idempotencyKey("abc")
                .strategyName("BuyAndHold")
                .assets("AAPL")
                .market("US")
                .startDate(START)
                .endDate(END)
                .initialCapital(new BigDecimal("10000.00"))
                .tradesJson("[]")
                .equityCurveJson("[]")
                .holdingsJson("{}")
                .build();
        when(simulationResultRepository.findByIdempotencyKey(anyString())).thenReturn(Optional.of(stored));

        // Act
        SimulationResponse response = simulationService.runSimulation(request);

        // Assert
        assertEquals(3L, response.getId());
        assertTrue(response.getIsExisting());
        assertEquals("Simulation already run. Returning stored results.", response.getMessage());
        verifyNoInteractions(strategyFactory, marketDataService);
        verify(simulationResultRepository, never()).save(any());
    }

    @Test
    void testIdempotencyKey_StableForEqualRequests() {
        // Arrange
        when(simulationResultRepository.findByIdempotencyKey(anyString())).thenReturn(Optional.empty());
        when(strategyFactory.createStrategy(any(), any(), any(), any(), any(), any()))
                .thenThrow(new IllegalArgumentException("stop here"));
        ArgumentCaptor<String> keys = ArgumentCaptor.forClass(String.class);

        // Act
        assertThrows(IllegalArgumentException.class, () -> simulationService.runSimulation(createRequest("AAPL")));
        assertThrows(IllegalArgumentException.class, () -> simulationService.runSimulation(createRequest("AAPL")));
        assertThrows(IllegalArgumentException.class, () -> simulationService.runSimulation(createRequest("MSFT")));

        // Assert
        verify(simulationResultRepository, times(3)).findByIdempotencyKey(keys.capture());
        List<String> captured = keys.getAllValues();
        assertEquals(64, captured.get(0).length());
        assertEquals(captured.get(0), captured.get(1));
        assertNotEquals(captured.get(0), captured.get(2));
    }

    @Test
    void testRunSimulation_SourceFailureRecordedAndPropagated() {
        // Arrange
        when(simulationResultRepository.findByIdempotencyKey(anyString())).thenReturn(Optional.empty());
        when(strategyFactory.createStrategy(any(), any(), any(), any(), any(), any()))
                .thenAnswer(invocation -> new BuyAndHoldStrategy(List.of("AAPL"),
                        new BigDecimal("10000.00"), MarketConfig.usMarket()));
        when(marketDataService.load(any(), any(), any(), any())).thenThrow(new SourceFetchException("down"));

        // Act & Assert
        assertThrows(SourceFetchException.class, () -> simulationService.runSimulation(createRequest("AAPL")));
        assertEquals(1.0, meterRegistry.counter("simulation.runs.failed").count());
        verify(simulationResultRepository, never()).save(any());
    }

    @Test
    void testGetSimulation_NotFound() {
        when(simulationResultRepository.findById(42L)).thenReturn(Optional.empty());

        assertThrows(SimulationNotFoundException.class, () -> simulationService.getSimulation(42L));
    }

    @Test
    void testExportTrades_WritesCsv() {
        // Arrange
        SimulationResult stored = SimulationResult.builder()
                .id(5L)
                .tradesJson("[{\"date\":\"2024-01-02\",\"asset\":\"AAPL\",\"action\":\"BUY\",\"rawPrice\":100,"
                        + "\"executedPrice\":100.05,\"quantity\":10,\"grossValue\":1000.50,"
                        + "\"netCashDelta\":-1000.50,\"commission\":0,\"tax\":0,\"slippageCost\":0.50}]")
                .build();
        when(simulationResultRepository.findById(5L)).thenReturn(Optional.of(stored));

        // Act
        String csv = simulationService.exportTrades(5L);

        // Assert
        String[] lines = csv.split("\n");
        assertEquals(TradeLogExporter.HEADER, lines[0]);
        assertEquals("2024-01-02,AAPL,100,100.05,BUY,10,1000.50,-1000.50,0,10", lines[1]);
    }

    private SimulationRequest createRequest(String asset) {
        return SimulationRequest.builder()
                .strategyName("BuyAndHold")
                .assets(List.of(asset))
                .startDate(START)
                .endDate(END)
                .initialCapital(new BigDecimal("10000.00"))
                .market(MarketPreset.US)
                .build();
    }
}
