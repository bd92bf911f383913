package com.quantsim.simulator.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * JPA configuration for ingested bars, the price cache table and stored simulation results.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.quantsim.simulator.repository")
@EnableJpaAuditing
@EnableTransactionManagement
public class JpaConfig {
}
