package com.relay.exception;

public class RetryCancelledException extends RelayException {

    public RetryCancelledException(String message) {
        super(message);
    }

    public RetryCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
