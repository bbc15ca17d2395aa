package com.dimosr.opentsdb;

import com.dimosr.opentsdb.core.MetricRegistry;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * The configuration of an OpenTSDB reporter, immutable once built
 *
 * Instances are created through {@link OpenTsdbConfigBuilder}
 */
public final class OpenTsdbConfig {
    private final InetSocketAddress address;
    private final MetricRegistry registry;
    private final Duration flushInterval;
    private final TimeUnit durationUnit;
    private final String prefix;
    private final ImmutableMap<String, String> tags;
    private final WriteFailurePolicy writeFailurePolicy;
    private final Duration connectTimeout;

    OpenTsdbConfig(final InetSocketAddress address,
                   final MetricRegistry registry,
                   final Duration flushInterval,
                   final TimeUnit durationUnit,
                   final String prefix,
                   final ImmutableMap<String, String> tags,
                   final WriteFailurePolicy writeFailurePolicy,
                   final Duration connectTimeout) {
        this.address = address;
        this.registry = registry;
        this.flushInterval = flushInterval;
        this.durationUnit = durationUnit;
        this.prefix = prefix;
        this.tags = tags;
        this.writeFailurePolicy = writeFailurePolicy;
        this.connectTimeout = connectTimeout;
    }

    public InetSocketAddress getAddress() {
        return address;
    }

    public MetricRegistry getRegistry() {
        return registry;
    }

    public Duration getFlushInterval() {
        return flushInterval;
    }

    /**
     * @return the unit timer durations are converted to before being reported
     */
    public TimeUnit getDurationUnit() {
        return durationUnit;
    }

    public String getPrefix() {
        return prefix;
    }

    public ImmutableMap<String, String> getTags() {
        return tags;
    }

    public WriteFailurePolicy getWriteFailurePolicy() {
        return writeFailurePolicy;
    }

    /**
     * @return the timeout for establishing the connection, where zero means no timeout
     */
    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("address", address)
                .add("flushInterval", flushInterval)
                .add("durationUnit", durationUnit)
                .add("prefix", prefix)
                .add("tags", tags)
                .add("writeFailurePolicy", writeFailurePolicy)
                .add("connectTimeout", connectTimeout)
                .toString();
    }
}
