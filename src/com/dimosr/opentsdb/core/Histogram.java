package com.dimosr.opentsdb.core;

/**
 * A distribution of integer samples
 */
public interface Histogram extends Metric {
    /**
     * @return an immutable copy of the histogram statistics at the moment of the call
     */
    HistogramSnapshot snapshot();
}
