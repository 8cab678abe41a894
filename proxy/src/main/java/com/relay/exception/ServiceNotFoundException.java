package com.relay.exception;

import lombok.Getter;

@Getter
public class ServiceNotFoundException extends RelayException {

    private final String serviceName;

    public ServiceNotFoundException(String serviceName) {
        super("No healthy instances of service " + serviceName + " found");
        this.serviceName = serviceName;
    }
}
