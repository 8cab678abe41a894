package com.relay.metrics;

import com.relay.model.CircuitState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
@RequiredArgsConstructor
public class DispatchMetrics {

    public static final String REQUESTS = "relay.dispatch.requests";
    public static final String CACHE = "relay.dispatch.cache";
    public static final String REJECTIONS = "relay.circuit.rejections";

    private final MeterRegistry meterRegistry;

    public Timer.Sample start() {
        return Timer.start(meterRegistry);
    }

    public void recordRequest(Timer.Sample sample, String service, String method, int status, Outcome outcome) {
        sample.stop(Timer.builder(REQUESTS)
                .description("Proxied requests by service and outcome")
                .tag("service", service)
                .tag("method", method)
                .tag("status", String.valueOf(status))
                .tag("outcome", outcome.tagValue())
                .register(meterRegistry));
    }

    public void recordCacheLookup(String service, boolean hit) {
        Counter.builder(CACHE)
                .description("Response cache lookups for read-only requests")
                .tag("service", service)
                .tag("result", hit ? "hit" : "miss")
                .register(meterRegistry)
                .increment();
    }

    public void recordRejection(String service, CircuitState state) {
        Counter.builder(REJECTIONS)
                .description("Requests refused by a circuit breaker")
                .tag("service", service)
                .tag("state", state.name())
                .register(meterRegistry)
                .increment();
    }

    public enum Outcome {
        SUCCESS,
        CACHE_HIT,
        CIRCUIT_REJECTED,
        CANCELLED,
        FAILED;

        String tagValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
