package com.dimosr.opentsdb;

import com.dimosr.opentsdb.core.Counter;
import com.dimosr.opentsdb.core.GaugeFloat64;
import com.dimosr.opentsdb.core.Meter;
import com.dimosr.opentsdb.exceptions.CollectorConnectionException;
import com.dimosr.opentsdb.util.ShortHostname;
import com.google.common.collect.ImmutableMap;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import javax.net.SocketFactory;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Reports to a collector listening on the loopback interface
 */
public class OpenTsdbExporterIntegrationTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1600000000L), ZoneOffset.UTC);

    private ServerSocket collector;
    private ExecutorService collectorExecutor;

    @Before
    public void startCollector() throws IOException {
        collector = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        collectorExecutor = Executors.newSingleThreadExecutor();
    }

    @After
    public void stopCollector() throws IOException {
        collectorExecutor.shutdownNow();
        collector.close();
    }

    @Test
    public void collectorReceivesAllLinesOfTheReport() throws Exception {
        Future<List<String>> received = collectorExecutor.submit(this::acceptOneConnection);
        MapMetricRegistry registry = new MapMetricRegistry()
                .register("requests", (Counter) () -> 12L)
                .register("load", (GaugeFloat64) () -> 0.25)
                .register("events", (Meter) () -> new StubSnapshot().withCount(7).withRates(1, 2, 3, 4));
        OpenTsdbConfig config = new OpenTsdbConfigBuilder(collectorAddress(), registry)
                .withPrefix("svc")
                .withTags(ImmutableMap.of("env", "test"))
                .withConnectTimeout(Duration.ofSeconds(1))
                .build();
        OpenTsdbExporter exporter = new OpenTsdbExporter(config, SocketFactory.getDefault(), CLOCK, new ShortHostname(() -> "worker-3.example.com"));

        int linesWritten = exporter.export();

        assertThat(linesWritten).isEqualTo(7);
        assertThat(received.get(5, TimeUnit.SECONDS)).containsExactly(
                "put svc.requests.count 1600000000 12 host=worker-3 env=test",
                "put svc.load.value 1600000000 0.250000 host=worker-3 env=test",
                "put svc.events.count 1600000000 7 host=worker-3 env=test",
                "put svc.events.one-minute 1600000000 1.00 host=worker-3 env=test",
                "put svc.events.five-minute 1600000000 2.00 host=worker-3 env=test",
                "put svc.events.fifteen-minute 1600000000 3.00 host=worker-3 env=test",
                "put svc.events.mean 1600000000 4.00 host=worker-3 env=test");
    }

    @Test
    public void reportFailsWhenNoCollectorIsListening() throws IOException {
        InetSocketAddress address = collectorAddress();
        collector.close();
        OpenTsdbConfig config = new OpenTsdbConfigBuilder(address, new MapMetricRegistry())
                .withConnectTimeout(Duration.ofSeconds(1))
                .build();
        OpenTsdbExporter exporter = new OpenTsdbExporter(config, SocketFactory.getDefault(), CLOCK, () -> "worker-3");

        assertThatThrownBy(exporter::export)
                .isInstanceOf(CollectorConnectionException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    private InetSocketAddress collectorAddress() {
        return new InetSocketAddress(collector.getInetAddress(), collector.getLocalPort());
    }

    private List<String> acceptOneConnection() throws IOException {
        List<String> lines = new ArrayList<>();
        try (Socket connection = collector.accept();
             BufferedReader reader = new BufferedReader(new InputStreamReader(connection.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while((line = reader.readLine()) != null) {
                lines.add(line);
            }
        }
        return lines;
    }
}
