package com.dimosr.opentsdb;

import com.dimosr.opentsdb.core.MetricRegistry;
import com.google.common.collect.ImmutableMap;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A builder used to configure the reporting of a registry to an OpenTSDB collector.
 *
 * Only the collector address and the registry are mandatory. The rest of the options default to:
 * - flush interval: 1 minute
 * - duration unit: nanoseconds (timer durations are reported as measured)
 * - prefix: none
 * - tags: none (only the host tag is reported)
 * - write failure policy: BEST_EFFORT
 * - connect timeout: none
 *
 * Every line sent to the collector has the form:
 *   put [prefix.]name.suffix timestamp value host=shorthostname [tag1=value1 tag2=value2 ...]
 */
public class OpenTsdbConfigBuilder {
    static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofMinutes(1);

    private final InetSocketAddress address;
    private final MetricRegistry registry;

    private Duration flushInterval = DEFAULT_FLUSH_INTERVAL;
    private TimeUnit durationUnit = TimeUnit.NANOSECONDS;
    private String prefix = "";
    private Map<String, String> tags = ImmutableMap.of();
    private WriteFailurePolicy writeFailurePolicy = WriteFailurePolicy.BEST_EFFORT;
    private Duration connectTimeout = Duration.ZERO;

    /**
     * @param address the address of the OpenTSDB collector
     * @param registry the registry whose metrics will be reported
     */
    public OpenTsdbConfigBuilder(final InetSocketAddress address, final MetricRegistry registry) {
        this.address = checkNotNull(address, "address");
        this.registry = checkNotNull(registry, "registry");
    }

    /**
     * @param flushInterval the interval between two consecutive reports
     */
    public OpenTsdbConfigBuilder withFlushInterval(final Duration flushInterval) {
        this.flushInterval = flushInterval;
        return this;
    }

    /**
     * Defines the unit timer durations will be converted to (e.g. MILLISECONDS).
     * Rates of timers are not affected.
     * @param durationUnit the unit used for the min, max, mean, std-dev and percentiles of timers
     */
    public OpenTsdbConfigBuilder withDurationUnit(final TimeUnit durationUnit) {
        this.durationUnit = durationUnit;
        return this;
    }

    /**
     * @param prefix the prefix prepended (followed by a dot) to the name of every metric
     */
    public OpenTsdbConfigBuilder withPrefix(final String prefix) {
        this.prefix = prefix;
        return this;
    }

    /**
     * @param tags the tags appended to every line, in addition to the host tag
     */
    public OpenTsdbConfigBuilder withTags(final Map<String, String> tags) {
        this.tags = tags;
        return this;
    }

    /**
     * @param writeFailurePolicy what to do when writing a metric to the collector fails
     */
    public OpenTsdbConfigBuilder withWriteFailurePolicy(final WriteFailurePolicy writeFailurePolicy) {
        this.writeFailurePolicy = writeFailurePolicy;
        return this;
    }

    /**
     * @param connectTimeout the maximum time to wait for the connection to the collector, zero meaning no timeout
     */
    public OpenTsdbConfigBuilder withConnectTimeout(final Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }

    public OpenTsdbConfig build() {
        checkNotNull(flushInterval, "flushInterval");
        checkArgument(!flushInterval.isNegative() && !flushInterval.isZero(), "The flush interval has to be positive, but it was: %s", flushInterval);
        checkNotNull(durationUnit, "durationUnit");
        checkNotNull(prefix, "prefix");
        checkNotNull(tags, "tags");
        checkNotNull(writeFailurePolicy, "writeFailurePolicy");
        checkNotNull(connectTimeout, "connectTimeout");
        checkArgument(!connectTimeout.isNegative(), "The connect timeout cannot be negative, but it was: %s", connectTimeout);
        checkArgument(connectTimeout.toMillis() <= Integer.MAX_VALUE, "The connect timeout is too large: %s", connectTimeout);

        return new OpenTsdbConfig(address,
                registry,
                flushInterval,
                durationUnit,
                prefix,
                ImmutableMap.copyOf(tags),
                writeFailurePolicy,
                connectTimeout);
    }
}
