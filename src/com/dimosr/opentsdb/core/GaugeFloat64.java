package com.dimosr.opentsdb.core;

public interface GaugeFloat64 extends Metric {
    double value();
}
