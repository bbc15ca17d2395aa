package com.dimosr.opentsdb;

import com.dimosr.opentsdb.core.Counter;
import com.dimosr.opentsdb.core.Gauge;
import com.dimosr.opentsdb.core.GaugeFloat64;
import com.dimosr.opentsdb.core.Histogram;
import com.dimosr.opentsdb.core.HistogramSnapshot;
import com.dimosr.opentsdb.core.Meter;
import com.dimosr.opentsdb.core.MeterSnapshot;
import com.dimosr.opentsdb.core.Metric;
import com.dimosr.opentsdb.core.MetricKind;
import com.dimosr.opentsdb.core.Timer;
import com.dimosr.opentsdb.core.TimerSnapshot;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Formats metrics into lines of the OpenTSDB put protocol.
 *
 * A formatter is created for a single reporting cycle, so that all the lines it produces
 * share the same timestamp, host and tags.
 *
 * The lines emitted for each kind of metric are the following:
 * - Counter: count
 * - Gauge, GaugeFloat64: value
 * - Histogram: count, min, max, mean, std-dev, 50/75/95/99/999-percentile
 * - Meter: count, one-minute, five-minute, fifteen-minute, mean
 * - Timer: count, min, max, mean, std-dev, 50/75/95/99/999-percentile, one-minute, five-minute, fifteen-minute, mean-rate
 */
class PutLineFormatter {
    static final double[] QUANTILES = {0.5, 0.75, 0.95, 0.99, 0.999};
    static final String[] PERCENTILE_SUFFIXES = {"50-percentile", "75-percentile", "95-percentile", "99-percentile", "999-percentile"};

    private static final Joiner PATH_JOINER = Joiner.on('.').skipNulls();
    private static final Joiner.MapJoiner TAGS_JOINER = Joiner.on(' ').withKeyValueSeparator('=');

    private final String prefix;
    private final long timestamp;
    private final String lineSuffix;
    private final long durationUnitInNanos;

    /**
     * @param prefix the prefix of every metric name, or empty for no prefix
     * @param timestamp the unix timestamp (in seconds) of every line
     * @param hostname the value of the host tag
     * @param tags the rendered tags, as produced by {@link #renderTags(Map)}
     * @param durationUnit the unit that timer durations are converted to
     */
    PutLineFormatter(final String prefix,
                     final long timestamp,
                     final String hostname,
                     final String tags,
                     final TimeUnit durationUnit) {
        this.prefix = Strings.emptyToNull(prefix);
        this.timestamp = timestamp;
        this.lineSuffix = tags.isEmpty() ? " host=" + hostname + "\n" : " host=" + hostname + " " + tags + "\n";
        this.durationUnitInNanos = durationUnit.toNanos(1);
    }

    /**
     * @return the tags as space-separated key=value tokens, in the iteration order of the map
     */
    static String renderTags(final Map<String, String> tags) {
        return TAGS_JOINER.join(tags);
    }

    /**
     * @param name the name of the metric
     * @param metric the metric
     * @return the put lines for the metric, each one terminated by a new line, or no lines if the kind of the metric is unknown
     */
    List<String> format(final String name, final Metric metric) {
        switch (MetricKind.of(metric)) {
            case COUNTER:
                return formatCounter(name, (Counter) metric);
            case GAUGE:
                return formatGauge(name, (Gauge) metric);
            case GAUGE_FLOAT64:
                return formatGaugeFloat64(name, (GaugeFloat64) metric);
            case HISTOGRAM:
                return formatHistogram(name, ((Histogram) metric).snapshot());
            case METER:
                return formatMeter(name, ((Meter) metric).snapshot());
            case TIMER:
                return formatTimer(name, ((Timer) metric).snapshot());
            case UNKNOWN:
            default:
                return ImmutableList.of();
        }
    }

    private List<String> formatCounter(final String name, final Counter counter) {
        return ImmutableList.of(line(name, "count", integer(counter.count())));
    }

    private List<String> formatGauge(final String name, final Gauge gauge) {
        return ImmutableList.of(line(name, "value", integer(gauge.value())));
    }

    private List<String> formatGaugeFloat64(final String name, final GaugeFloat64 gauge) {
        return ImmutableList.of(line(name, "value", String.format(Locale.ROOT, "%f", gauge.value())));
    }

    private List<String> formatHistogram(final String name, final HistogramSnapshot snapshot) {
        ImmutableList.Builder<String> lines = ImmutableList.builder();
        lines.add(line(name, "count", integer(snapshot.count())));
        lines.add(line(name, "min", integer(snapshot.min())));
        lines.add(line(name, "max", integer(snapshot.max())));
        lines.add(line(name, "mean", decimal(snapshot.mean())));
        lines.add(line(name, "std-dev", decimal(snapshot.stdDev())));
        double[] percentiles = snapshot.percentiles(QUANTILES.clone());
        for(int i = 0; i < PERCENTILE_SUFFIXES.length; i++) {
            lines.add(line(name, PERCENTILE_SUFFIXES[i], decimal(percentiles[i])));
        }
        return lines.build();
    }

    private List<String> formatMeter(final String name, final MeterSnapshot snapshot) {
        return ImmutableList.of(
                line(name, "count", integer(snapshot.count())),
                line(name, "one-minute", decimal(snapshot.rate1())),
                line(name, "five-minute", decimal(snapshot.rate5())),
                line(name, "fifteen-minute", decimal(snapshot.rate15())),
                line(name, "mean", decimal(snapshot.rateMean())));
    }

    private List<String> formatTimer(final String name, final TimerSnapshot snapshot) {
        final double unit = durationUnitInNanos;

        ImmutableList.Builder<String> lines = ImmutableList.builder();
        lines.add(line(name, "count", integer(snapshot.count())));
        lines.add(line(name, "min", integer(snapshot.min() / durationUnitInNanos)));
        lines.add(line(name, "max", integer(snapshot.max() / durationUnitInNanos)));
        lines.add(line(name, "mean", decimal(snapshot.mean() / unit)));
        lines.add(line(name, "std-dev", decimal(snapshot.stdDev() / unit)));
        double[] percentiles = snapshot.percentiles(QUANTILES.clone());
        for(int i = 0; i < PERCENTILE_SUFFIXES.length; i++) {
            lines.add(line(name, PERCENTILE_SUFFIXES[i], decimal(percentiles[i] / unit)));
        }
        lines.add(line(name, "one-minute", decimal(snapshot.rate1())));
        lines.add(line(name, "five-minute", decimal(snapshot.rate5())));
        lines.add(line(name, "fifteen-minute", decimal(snapshot.rate15())));
        lines.add(line(name, "mean-rate", decimal(snapshot.rateMean())));
        return lines.build();
    }

    private String line(final String name, final String suffix, final String value) {
        return "put " + PATH_JOINER.join(prefix, name, suffix) + " " + timestamp + " " + value + lineSuffix;
    }

    private static String integer(final long value) {
        return Long.toString(value);
    }

    private static String decimal(final double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
