package com.quantsim.simulator.exception;

public class SimulationNotFoundException extends RuntimeException {

    public SimulationNotFoundException(Long id) {
        super("Simulation not found: " + id);
    }
}
