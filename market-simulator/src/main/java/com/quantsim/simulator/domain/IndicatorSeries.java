package com.quantsim.simulator.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A named market-wide series (oil, bond yields, an index) loaded alongside the traded
 * assets and shown to every strategy. Bars come from a price provider like any asset.
 */
@Value
@Builder
public class IndicatorSeries {

    String name;
    String asset;
    String source;
}
