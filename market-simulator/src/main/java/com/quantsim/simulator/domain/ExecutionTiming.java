package com.quantsim.simulator.domain;

/**
 * Which bar an order decided on day D is filled against.
 */
public enum ExecutionTiming {
    /** Fill at the close of the bar the decision was made on. */
    SAME_BAR_CLOSE,
    /** Queue the order and fill it at the open of the next tick. */
    NEXT_BAR_OPEN
}
