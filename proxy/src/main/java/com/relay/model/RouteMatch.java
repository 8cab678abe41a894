package com.relay.model;

public record RouteMatch(RouteEntry route, String forwardPath) {

    public String serviceName() {
        return route.getServiceName();
    }
}
