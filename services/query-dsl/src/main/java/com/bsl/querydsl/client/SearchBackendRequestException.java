package com.bsl.querydsl.client;

public class SearchBackendRequestException extends SearchBackendException {
    private final int status;

    public SearchBackendRequestException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public SearchBackendRequestException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
