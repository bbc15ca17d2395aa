package com.dimosr.opentsdb.core;

/**
 * Point-in-time statistics of a timer
 *
 * All duration values (min, max, mean, std-dev, percentiles) are expressed in nanoseconds
 */
public interface TimerSnapshot extends HistogramSnapshot, MeterSnapshot {
}
