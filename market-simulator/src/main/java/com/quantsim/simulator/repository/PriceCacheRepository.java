package com.quantsim.simulator.repository;

import com.quantsim.simulator.domain.PriceCacheRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for persisted price cache units.
 */
@Repository
public interface PriceCacheRepository extends JpaRepository<PriceCacheRecord, Long> {

    Optional<PriceCacheRecord> findByAssetAndSourceAndSamplingInterval(String asset, String source,
                                                                        String samplingInterval);
}
