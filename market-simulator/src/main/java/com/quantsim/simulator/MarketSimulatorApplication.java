package com.quantsim.simulator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Market Simulator service.
 * Runs simulations synchronously on the request thread.
 */
@SpringBootApplication
public class MarketSimulatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketSimulatorApplication.class, args);
    }

}
