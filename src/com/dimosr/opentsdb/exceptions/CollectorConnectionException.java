package com.dimosr.opentsdb.exceptions;

/**
 * An exception denoting that a connection to the collector could not be established
 */
public class CollectorConnectionException extends RuntimeException {
    public CollectorConnectionException(final String message, final Throwable e) {
        super(message, e);
    }
}
