package com.quantsim.simulator.marketdata;

import lombok.Value;

/**
 * Identity of one cache unit: an asset as delivered by one source at one sampling interval.
 */
@Value
public class CacheKey {

    String asset;
    String source;
    String interval;

    /**
     * Flat form used as a key by stores that need a string, e.g. {@code csv:AAPL:1d}.
     */
    public String asString() {
        return source + ":" + asset + ":" + interval;
    }
}
