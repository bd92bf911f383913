package com.quantsim.simulator.service;

import com.quantsim.simulator.controller.dto.SimulationRequest;
import com.quantsim.simulator.controller.dto.SimulationResponse;

/**
 * Service interface for running simulations and reading their stored results.
 */
public interface SimulationService {

    /**
     * Run a simulation synchronously, or return the stored result of an identical request.
     *
     * @param request the simulation request
     * @return the run's metrics, trade log and equity curve
     * @throws com.quantsim.simulator.exception.SourceFetchException when price data cannot be loaded
     */
    SimulationResponse runSimulation(SimulationRequest request);

    /**
     * @throws com.quantsim.simulator.exception.SimulationNotFoundException for an unknown id
     */
    SimulationResponse getSimulation(Long id);

    /**
     * Trade log of a stored run as CSV.
     *
     * @throws com.quantsim.simulator.exception.SimulationNotFoundException for an unknown id
     */
    String exportTrades(Long id);
}
