package com.relay.exception;

public class CacheWriteException extends RelayException {

    public CacheWriteException(String key, Throwable cause) {
        super("Failed to cache response under " + key, cause);
    }
}
