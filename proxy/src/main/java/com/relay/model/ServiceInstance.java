package com.relay.model;

import lombok.Getter;

@Getter
public class ServiceInstance {

    private final String id;
    private final String serviceName;
    private final String url;
    private final int weight;
    private volatile boolean healthy;

    public ServiceInstance(String id, String serviceName, String url, int weight) {
        this.id = id;
        this.serviceName = serviceName;
        this.url = stripTrailingSlash(url);
        this.weight = Math.max(0, Math.min(100, weight));
        this.healthy = true;
    }

    public boolean markHealthy(boolean nowHealthy) {
        if (this.healthy == nowHealthy) {
            return false;
        }
        this.healthy = nowHealthy;
        return true;
    }

    private static String stripTrailingSlash(String url) {
        if (url != null && url.endsWith("/")) {
            return url.substring(0, url.length() - 1);
        }
        return url;
    }
}
