package com.dimosr.opentsdb.core;

public interface Counter extends Metric {
    long count();
}
