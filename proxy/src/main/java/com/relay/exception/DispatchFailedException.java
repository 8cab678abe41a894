package com.relay.exception;

import lombok.Getter;

@Getter
public class DispatchFailedException extends RelayException {

    private final String serviceName;

    public DispatchFailedException(String serviceName, Throwable cause) {
        super("All retry attempts failed for " + serviceName + ": " + cause.getMessage(), cause);
        this.serviceName = serviceName;
    }
}
