package com.dimosr.opentsdb.core;

/**
 * The kinds of metrics that can be reported
 *
 * Any metric that does not implement one of the known interfaces is classified as UNKNOWN.
 * When a metric implements more than one of them, the first one in declaration order wins.
 */
public enum MetricKind {
    COUNTER,
    GAUGE,
    GAUGE_FLOAT64,
    HISTOGRAM,
    METER,
    TIMER,
    UNKNOWN;

    public static MetricKind of(final Metric metric) {
        if(metric instanceof Counter) {
            return COUNTER;
        } else if(metric instanceof Gauge) {
            return GAUGE;
        } else if(metric instanceof GaugeFloat64) {
            return GAUGE_FLOAT64;
        } else if(metric instanceof Histogram) {
            return HISTOGRAM;
        } else if(metric instanceof Meter) {
            return METER;
        } else if(metric instanceof Timer) {
            return TIMER;
        }
        return UNKNOWN;
    }
}
