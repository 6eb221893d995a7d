package com.bsl.querydsl.client;

public class SearchBackendUnavailableException extends SearchBackendException {
    public SearchBackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
