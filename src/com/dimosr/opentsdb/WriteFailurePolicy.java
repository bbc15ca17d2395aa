package com.dimosr.opentsdb;

/**
 * The policies available for failures while writing metrics to the collector:
 * - BEST_EFFORT: the failure is logged and the remaining metrics of the cycle are still written
 * - ABORT_CYCLE: the first failure aborts the cycle, the remaining metrics are not written
 *   and a MetricsWriteException is thrown
 *
 * In both cases the connection is closed at the end of the cycle and the reporter carries on with the next tick.
 */
public enum WriteFailurePolicy {
    BEST_EFFORT,
    ABORT_CYCLE
}
