package com.relay.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class DispatchRequest {

    String method;
    String path;
    String query;
    @Singular
    Map<String, List<String>> headers;
    byte[] body;
    String remoteAddress;
    String scheme;
    String host;

    public boolean isCacheEligible() {
        return "GET".equalsIgnoreCase(method);
    }

    public String pathWithQuery() {
        if (query == null || query.isEmpty()) {
            return path;
        }
        return path + "?" + query;
    }

    public String firstHeader(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }
}
