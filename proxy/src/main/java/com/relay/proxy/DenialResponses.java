package com.relay.proxy;

import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

final class DenialResponses {

    static final String RATE_LIMITED =
            "{\"success\": false, \"message\": \"Rate limit exceeded. Please try again later.\"}";
    static final String SERVICE_UNAVAILABLE =
            "{\"success\": false, \"message\": \"Service temporarily unavailable\"}";
    static final String SERVICE_ERROR =
            "{\"success\": false, \"message\": \"Service error\"}";
    static final String GATEWAY_TIMEOUT =
            "{\"success\": false, \"message\": \"Gateway timeout\"}";

    private DenialResponses() {
    }

    static void write(HttpServletResponse response, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        response.setStatus(status);
        response.setContentType("application/json");
        response.setContentLength(bytes.length);
        response.getOutputStream().write(bytes);
    }
}
