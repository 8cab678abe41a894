package com.relay.control;

@FunctionalInterface
public interface CheckedRunnable {

    void run() throws Exception;
}
