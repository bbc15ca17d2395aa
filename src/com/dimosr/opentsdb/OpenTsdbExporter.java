package com.dimosr.opentsdb;

import com.dimosr.opentsdb.core.Metric;
import com.dimosr.opentsdb.exceptions.CollectorConnectionException;
import com.dimosr.opentsdb.exceptions.MetricsWriteException;
import com.dimosr.opentsdb.util.ShortHostname;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.SocketFactory;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Performs a single report of a registry to an OpenTSDB collector:
 * connects, writes the put lines of every metric and disconnects.
 *
 * A new connection is opened for every report, and closed at the end of it, whatever the outcome.
 * The writer is flushed after each metric, so that a failure on a later metric does not lose
 * the lines of the metrics already written.
 */
public class OpenTsdbExporter {
    private static final Logger log = LoggerFactory.getLogger(OpenTsdbExporter.class);

    private final OpenTsdbConfig config;
    private final SocketFactory socketFactory;
    private final Clock clock;
    private final Supplier<String> shortHostname;

    public OpenTsdbExporter(final OpenTsdbConfig config) {
        this(config, SocketFactory.getDefault(), Clock.systemUTC(), new ShortHostname());
    }

    /**
     * @param config the configuration of the reports
     * @param socketFactory the factory used to create the connection to the collector
     * @param clock the clock providing the timestamp of each report
     * @param shortHostname the supplier of the value of the host tag
     */
    OpenTsdbExporter(final OpenTsdbConfig config,
                     final SocketFactory socketFactory,
                     final Clock clock,
                     final Supplier<String> shortHostname) {
        this.config = config;
        this.socketFactory = socketFactory;
        this.clock = clock;
        this.shortHostname = shortHostname;
    }

    /**
     * Reports all the metrics of the registry once
     *
     * @return the number of lines written to the collector
     * @throws CollectorConnectionException if the connection to the collector could not be established, in which case nothing is written
     * @throws MetricsWriteException if writing a metric failed and the write failure policy is ABORT_CYCLE
     */
    public int export() {
        final String hostname = shortHostname.get();
        final long timestamp = clock.instant().getEpochSecond();
        final String tags = PutLineFormatter.renderTags(config.getTags());
        final PutLineFormatter formatter = new PutLineFormatter(config.getPrefix(), timestamp, hostname, tags, config.getDurationUnit());

        final Socket socket = connect();
        try {
            final Writer writer = new BufferedWriter(new OutputStreamWriter(outputStreamOf(socket), StandardCharsets.UTF_8));
            final MetricWriter metricWriter = new MetricWriter(formatter, writer);
            config.getRegistry().each(metricWriter);

            if(metricWriter.failedMetrics > 0) {
                log.warn("{} out of {} metrics could not be written to {}", metricWriter.failedMetrics, metricWriter.metrics, config.getAddress());
            }
            log.debug("Wrote {} lines for {} metrics to {} with timestamp {}", metricWriter.linesWritten, metricWriter.metrics, config.getAddress(), timestamp);
            return metricWriter.linesWritten;
        } finally {
            close(socket);
        }
    }

    private Socket connect() {
        final InetSocketAddress address = resolve(config.getAddress());
        final Socket socket;
        try {
            socket = socketFactory.createSocket();
        } catch (IOException e) {
            throw new CollectorConnectionException("Could not create a socket for " + address, e);
        }

        try {
            socket.connect(address, (int) config.getConnectTimeout().toMillis());
            return socket;
        } catch (IOException e) {
            close(socket);
            throw new CollectorConnectionException("Could not connect to OpenTSDB collector at " + address, e);
        }
    }

    /**
     * An unresolved address is resolved again on every report, so that DNS changes are picked up
     */
    private static InetSocketAddress resolve(final InetSocketAddress address) {
        if(address.isUnresolved()) {
            return new InetSocketAddress(address.getHostString(), address.getPort());
        }
        return address;
    }

    private OutputStream outputStreamOf(final Socket socket) {
        try {
            return socket.getOutputStream();
        } catch (IOException e) {
            throw new CollectorConnectionException("Could not open the output stream to " + config.getAddress(), e);
        }
    }

    private void close(final Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.warn("Failed to close the connection to {}", config.getAddress(), e);
        }
    }

    /**
     * Writes the lines of each metric provided by the registry, flushing after every metric
     */
    private class MetricWriter implements BiConsumer<String, Metric> {
        private final PutLineFormatter formatter;
        private final Writer writer;

        private int metrics = 0;
        private int failedMetrics = 0;
        private int linesWritten = 0;

        private MetricWriter(final PutLineFormatter formatter, final Writer writer) {
            this.formatter = formatter;
            this.writer = writer;
        }

        @Override
        public void accept(final String name, final Metric metric) {
            metrics++;
            final List<String> lines = formatter.format(name, metric);
            try {
                for(String line : lines) {
                    writer.write(line);
                }
                writer.flush();
                linesWritten += lines.size();
            } catch (IOException e) {
                failedMetrics++;
                if(config.getWriteFailurePolicy() == WriteFailurePolicy.ABORT_CYCLE) {
                    throw new MetricsWriteException("Failed to write metric " + name + " to " + config.getAddress(), e);
                }
                log.debug("Failed to write metric {} to {}", name, config.getAddress(), e);
            }
        }
    }
}
