package com.dimosr.opentsdb.core;

/**
 * Point-in-time statistics of a distribution of samples
 *
 * Implementations must be immutable, so that all the values read
 * from a single snapshot are consistent with each other
 */
public interface HistogramSnapshot {
    long count();
    long min();
    long max();
    double mean();
    double stdDev();

    /**
     * @param quantiles the requested quantiles, each one in the range [0, 1]
     * @return the value of each requested quantile, in the same order as the quantiles
     */
    double[] percentiles(double[] quantiles);
}
