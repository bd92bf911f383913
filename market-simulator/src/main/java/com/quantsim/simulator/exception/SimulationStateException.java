package com.quantsim.simulator.exception;

public class SimulationStateException extends RuntimeException {

    public SimulationStateException(String message) {
        super(message);
    }
}
