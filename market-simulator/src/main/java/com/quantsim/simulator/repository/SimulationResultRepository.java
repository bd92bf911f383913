package com.quantsim.simulator.repository;

import com.quantsim.simulator.domain.SimulationResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for stored simulation results.
 */
@Repository
public interface SimulationResultRepository extends JpaRepository<SimulationResult, Long> {

    /**
     * Find the result of an identical earlier request.
     */
    Optional<SimulationResult> findByIdempotencyKey(String idempotencyKey);
}
