package com.bsl.querydsl.common;

/**
 * Raised when a query cannot run because something it depends on is not configured:
 * no bound client, no connection resolver, an unknown connection or cache store name.
 */
public class QueryConfigurationException extends RuntimeException {
    public QueryConfigurationException(String message) {
        super(message);
    }

    public QueryConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
