package com.dimosr.opentsdb.exceptions;

public class MetricsWriteException extends RuntimeException {
    public MetricsWriteException(final String message, final Throwable e) {
        super(message, e);
    }
}
