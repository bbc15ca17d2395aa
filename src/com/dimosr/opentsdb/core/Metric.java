package com.dimosr.opentsdb.core;

/**
 * A metric held by a {@link MetricRegistry}
 *
 * The reporter understands the sub-interfaces declared in this package
 * (see {@link MetricKind}). Any other implementation is skipped when reporting.
 */
public interface Metric {
}
