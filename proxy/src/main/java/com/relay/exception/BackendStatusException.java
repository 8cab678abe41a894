package com.relay.exception;

import lombok.Getter;

@Getter
public class BackendStatusException extends RelayException {

    private final int statusCode;

    public BackendStatusException(int statusCode) {
        super("Retryable status code: " + statusCode);
        this.statusCode = statusCode;
    }
}
