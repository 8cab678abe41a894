package com.relay.proxy;

import jakarta.servlet.http.HttpServletRequest;

final class ClientIdentity {

    private ClientIdentity() {
    }

    static String resolve(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return forwardedFor.split(",")[0].trim();
        }

        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }

        String remote = request.getRemoteAddr();
        return remote != null ? remote : "unknown";
    }
}
