package com.quantsim.simulator.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Persisted cache unit: raw provider payload and normalized bars of one asset,
 * from one source, at one sampling interval.
 */
@Entity
@Table(name = "price_cache", uniqueConstraints = {
        @UniqueConstraint(name = "uk_price_cache_key", columnNames = { "asset", "source", "sampling_interval" })
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PriceCacheRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "asset", nullable = false, length = 32)
    private String asset;

    @Column(name = "source", nullable = false, length = 32)
    private String source;

    @Column(name = "sampling_interval", nullable = false, length = 16)
    private String samplingInterval;

    @Column(name = "raw_payload", columnDefinition = "TEXT")
    private String rawPayload;

    @Column(name = "bars_json", nullable = false, columnDefinition = "TEXT")
    private String barsJson;

    @Column(name = "min_date")
    private LocalDate minDate;

    @Column(name = "max_date")
    private LocalDate maxDate;

    @Column(name = "covered_from")
    private LocalDate coveredFrom;

    @Column(name = "covered_to")
    private LocalDate coveredTo;

    @Column(name = "fetched_at", nullable = false)
    private Instant fetchedAt;
}
