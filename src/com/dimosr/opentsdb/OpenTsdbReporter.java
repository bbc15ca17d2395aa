package com.dimosr.opentsdb;

import com.dimosr.opentsdb.core.MetricRegistry;
import com.google.common.base.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Reports a registry to an OpenTSDB collector periodically, until stopped.
 *
 * {@link #run()} blocks the calling thread, so the reporter is meant to be given a dedicated thread, e.g.
 * <pre>
 *     executorService.submit(reporter);
 *     ...
 *     reporter.stop();
 * </pre>
 *
 * Reports are performed on a fixed-rate schedule. If a report takes longer than the flush interval,
 * the next one starts right after it and the ones that were missed are skipped, so reports never overlap
 * and never pile up. A failed report is logged and does not stop the reporter.
 */
public class OpenTsdbReporter implements Runnable, Closeable {
    private static final Logger log = LoggerFactory.getLogger(OpenTsdbReporter.class);

    private final OpenTsdbExporter exporter;
    private final Duration flushInterval;
    private final Ticker ticker;
    private final String collector;

    private final CountDownLatch stopSignal = new CountDownLatch(1);

    public OpenTsdbReporter(final OpenTsdbConfig config) {
        this(new OpenTsdbExporter(config), config.getFlushInterval(), Ticker.systemTicker(), config.getAddress().toString());
    }

    OpenTsdbReporter(final OpenTsdbExporter exporter,
                     final Duration flushInterval,
                     final Ticker ticker,
                     final String collector) {
        this.exporter = exporter;
        this.flushInterval = flushInterval;
        this.ticker = ticker;
        this.collector = collector;
    }

    /**
     * Creates a reporter with the given options, reporting timer durations in nanoseconds
     *
     * @param registry the registry whose metrics will be reported
     * @param flushInterval the interval between two consecutive reports
     * @param prefix the prefix prepended to the name of every metric
     * @param address the address of the OpenTSDB collector
     * @param tags the tags appended to every line, in addition to the host tag
     */
    public static OpenTsdbReporter forRegistry(final MetricRegistry registry,
                                               final Duration flushInterval,
                                               final String prefix,
                                               final InetSocketAddress address,
                                               final Map<String, String> tags) {
        OpenTsdbConfig config = new OpenTsdbConfigBuilder(address, registry)
                .withFlushInterval(flushInterval)
                .withDurationUnit(TimeUnit.NANOSECONDS)
                .withPrefix(prefix)
                .withTags(tags)
                .build();
        return new OpenTsdbReporter(config);
    }

    /**
     * Reports metrics every flush interval, until {@link #stop()} is called or the thread is interrupted.
     * A report in progress when the reporter is stopped is completed before returning.
     */
    @Override
    public void run() {
        final long intervalInNanos = flushInterval.toNanos();
        log.info("Reporting metrics to {} every {}", collector, flushInterval);

        long nextTick = ticker.read() + intervalInNanos;
        try {
            while(!awaitTick(nextTick)) {
                reportOnce();
                nextTick = nextTickAfter(nextTick, ticker.read(), intervalInNanos);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Reporter to {} interrupted", collector);
        }
        log.info("Stopped reporting metrics to {}", collector);
    }

    /**
     * Stops the reporter. Calling it more than once, or before the reporter has started, has no further effect.
     */
    public void stop() {
        stopSignal.countDown();
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isStopped() {
        return stopSignal.getCount() == 0;
    }

    /**
     * @return true if the reporter was stopped while waiting
     */
    private boolean awaitTick(final long tick) throws InterruptedException {
        return stopSignal.await(tick - ticker.read(), TimeUnit.NANOSECONDS);
    }

    private void reportOnce() {
        try {
            exporter.export();
        } catch (RuntimeException e) {
            log.error("Failed to report metrics to {}", collector, e);
        }
    }

    /**
     * Computes the tick following the given one on the grid of ticks spaced by the interval.
     * Ticks that have already passed are skipped, except for the latest one, which is returned so that it fires immediately.
     */
    static long nextTickAfter(final long previousTick, final long now, final long interval) {
        long nextTick = previousTick + interval;
        if(nextTick < now) {
            long missedTicks = (now - nextTick) / interval;
            nextTick += missedTicks * interval;
        }
        return nextTick;
    }
}
