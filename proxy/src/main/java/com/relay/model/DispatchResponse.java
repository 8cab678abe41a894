package com.relay.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class DispatchResponse {

    int statusCode;
    @Singular
    Map<String, List<String>> headers;
    byte[] body;
    String contentType;
    boolean cacheHit;

    public static DispatchResponse fromCache(CachedResponse cached) {
        return DispatchResponse.builder()
                .statusCode(cached.statusCode())
                .body(cached.body())
                .contentType(cached.contentType())
                .cacheHit(true)
                .build();
    }

    public CachedResponse toCached() {
        return new CachedResponse(statusCode, body, contentType);
    }
}
