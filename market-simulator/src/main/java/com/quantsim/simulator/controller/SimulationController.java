package com.quantsim.simulator.controller;

import com.quantsim.simulator.controller.dto.SimulationRequest;
import com.quantsim.simulator.controller.dto.SimulationResponse;
import com.quantsim.simulator.service.SimulationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for simulation runs.
 */
@RestController
@RequestMapping("/simulations")
@RequiredArgsConstructor
@Slf4j
public class SimulationController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final SimulationService simulationService;

    /**
     * Run a simulation.
     *
     * @param request the simulation request
     * @return the run's results
     */
    @PostMapping
    public ResponseEntity<SimulationResponse> runSimulation(@Valid @RequestBody SimulationRequest request) {

        log.info("POST /simulations - Strategy: {}, Assets: {}", request.getStrategyName(), request.getAssets());

        SimulationResponse response = simulationService.runSimulation(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{id}")
    public ResponseEntity<SimulationResponse> getSimulation(@PathVariable Long id) {

        log.info("GET /simulations/{}", id);

        return ResponseEntity.ok(simulationService.getSimulation(id));
    }

    @GetMapping("/{id}/trades.csv")
    public ResponseEntity<String> exportTrades(@PathVariable Long id) {

        log.info("GET /simulations/{}/trades.csv", id);

        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"simulation-" + id + "-trades.csv\"")
                .body(simulationService.exportTrades(id));
    }
}
