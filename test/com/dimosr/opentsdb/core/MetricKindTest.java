package com.dimosr.opentsdb.core;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class MetricKindTest {

    @Test
    public void eachKnownInterfaceIsClassifiedAsItsKind() {
        assertThat(MetricKind.of((Counter) () -> 1L)).isEqualTo(MetricKind.COUNTER);
        assertThat(MetricKind.of((Gauge) () -> 1L)).isEqualTo(MetricKind.GAUGE);
        assertThat(MetricKind.of((GaugeFloat64) () -> 1.0)).isEqualTo(MetricKind.GAUGE_FLOAT64);
        assertThat(MetricKind.of((Histogram) () -> null)).isEqualTo(MetricKind.HISTOGRAM);
        assertThat(MetricKind.of((Meter) () -> null)).isEqualTo(MetricKind.METER);
        assertThat(MetricKind.of((Timer) () -> null)).isEqualTo(MetricKind.TIMER);
    }

    @Test
    public void otherMetricsAreUnknown() {
        assertThat(MetricKind.of(new Metric() {})).isEqualTo(MetricKind.UNKNOWN);
    }

    @Test
    public void missingMetricIsUnknown() {
        assertThat(MetricKind.of(null)).isEqualTo(MetricKind.UNKNOWN);
    }

    @Test
    public void metricImplementingSeveralInterfacesIsClassifiedByTheFirstKind() {
        assertThat(MetricKind.of(new CountingGauge())).isEqualTo(MetricKind.COUNTER);
    }

    private static class CountingGauge implements Counter, Gauge {
        @Override
        public long count() {
            return 0;
        }

        @Override
        public long value() {
            return 0;
        }
    }
}
