package com.dimosr.opentsdb.core;

/**
 * Point-in-time rates of a meter, in events per second
 */
public interface MeterSnapshot {
    long count();
    double rate1();
    double rate5();
    double rate15();
    double rateMean();
}
