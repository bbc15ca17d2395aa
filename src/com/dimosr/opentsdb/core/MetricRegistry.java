package com.dimosr.opentsdb.core;

import java.util.function.BiConsumer;

/**
 * An abstraction of a registry holding named metrics
 *
 * How the metrics are stored and updated depends on each implementation.
 * The reporter only reads them, and makes no assumption about the iteration order.
 */
public interface MetricRegistry {
    /**
     * Invokes the consumer once for every registered metric
     * @param consumer the callback receiving the name of each metric and the metric itself
     */
    void each(BiConsumer<String, Metric> consumer);
}
