package com.kotsin.insights.store;

/**
 * Storage or (de)serialization failure in the report store.
 */
public class ReportStoreException extends RuntimeException {

    public ReportStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
