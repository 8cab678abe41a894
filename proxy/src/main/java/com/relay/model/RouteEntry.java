package com.relay.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RouteEntry {

    String pathPrefix;
    String serviceName;
    @Builder.Default
    boolean stripPrefix = true;
    RateLimit rateLimit;

    public boolean hasRateLimit() {
        return rateLimit != null;
    }

    public record RateLimit(int ratePerMinute, int burst) {}
}
