package com.dimosr.opentsdb.core;

/**
 * A histogram of durations, measured in nanoseconds, combined with a meter of their rate
 */
public interface Timer extends Metric {
    TimerSnapshot snapshot();
}
