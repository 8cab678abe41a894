package com.relay.model;

public record CachedResponse(int statusCode, byte[] body, String contentType) {}
