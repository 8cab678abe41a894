package com.relay.exception;

public class TransportException extends RelayException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
