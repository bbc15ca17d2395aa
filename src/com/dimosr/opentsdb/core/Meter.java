package com.dimosr.opentsdb.core;

/**
 * A rate of events, tracked as a mean rate and as 1/5/15-minute moving averages
 */
public interface Meter extends Metric {
    MeterSnapshot snapshot();
}
