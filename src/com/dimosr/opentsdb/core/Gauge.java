package com.dimosr.opentsdb.core;

public interface Gauge extends Metric {
    long value();
}
