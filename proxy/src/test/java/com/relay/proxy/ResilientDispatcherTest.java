package com.relay.proxy;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import com.relay.cache.InMemoryResponseCache;
import com.relay.control.CircuitBreakerRegistry;
import com.relay.control.CircuitBreakerSettings;
import com.relay.control.Deadline;
import com.relay.control.RetryExecutor;
import com.relay.control.RetryPolicy;
import com.relay.exception.CircuitOpenException;
import com.relay.exception.DispatchFailedException;
import com.relay.exception.RetryCancelledException;
import com.relay.exception.RetryExhaustedException;
import com.relay.model.CircuitState;
import com.relay.model.DispatchRequest;
import com.relay.model.DispatchResponse;
import com.relay.model.RouteEntry;
import com.relay.model.RouteMatch;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ResilientDispatcher")
class ResilientDispatcherTest {

    private WireMockServer backend;
    private ServiceRegistry serviceRegistry;
    private InMemoryResponseCache cache;
    private CircuitBreakerRegistry circuitBreakers;
    private ResilientDispatcher dispatcher;

    private final RetryPolicy fastRetries = RetryPolicy.builder()
            .maxAttempts(3)
            .initialDelay(Duration.ofMillis(1))
            .maxDelay(Duration.ofMillis(5))
            .jitter(false)
            .build();

    @BeforeEach
    void setUp() {
        backend = new WireMockServer(options().dynamicPort());
        backend.start();

        serviceRegistry = new ServiceRegistry();
        serviceRegistry.register("orders", "orders-1", backend.baseUrl(), 100);

        cache = new InMemoryResponseCache();
        circuitBreakers = new CircuitBreakerRegistry(CircuitBreakerSettings.builder()
                .maxHalfOpenProbes(3)
                .openTimeout(Duration.ofSeconds(30))
                .minRequestThreshold(5)
                .failureRateThreshold(0.5)
                .build());

        dispatcher = new ResilientDispatcher(
                serviceRegistry,
                cache,
                circuitBreakers,
                new RetryExecutor(),
                fastRetries,
                RetryPolicy.RETRYABLE_HTTP_STATUSES,
                new BackendClient(Duration.ofSeconds(2), Duration.ofSeconds(5)),
                Duration.ofSeconds(300));
    }

    @AfterEach
    void tearDown() {
        backend.stop();
    }

    private static DispatchRequest getRequest(String path) {
        return DispatchRequest.builder()
                .method("GET")
                .path(path)
                .remoteAddress("10.0.0.9")
                .scheme("http")
                .host("gateway.local")
                .build();
    }

    private static String body(DispatchResponse response) {
        return new String(response.getBody(), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("caching")
    class Caching {

        @Test
        @DisplayName("routes /svc/items to orders and serves the repeat from cache")
        void endToEndRouteAndCache() {
            backend.stubFor(get(urlEqualTo("/items"))
                    .willReturn(aResponse().withStatus(200)
                            .withHeader("Content-Type", "application/json")
                            .withBody("[1,2,3]")));

            RouteTable routes = new RouteTable(List.of(RouteEntry.builder()
                    .pathPrefix("/svc/*")
                    .serviceName("orders")
                    .build()));
            RouteMatch match = routes.match("/svc/items").orElseThrow();

            DispatchResponse first = dispatcher.dispatch(
                    match.serviceName(), getRequest(match.forwardPath()), Deadline.after(Duration.ofSeconds(25)));
            DispatchResponse second = dispatcher.dispatch(
                    match.serviceName(), getRequest(match.forwardPath()), Deadline.after(Duration.ofSeconds(25)));

            assertThat(first.isCacheHit()).isFalse();
            assertThat(body(first)).isEqualTo("[1,2,3]");
            assertThat(first.getContentType()).isEqualTo("application/json");

            assertThat(second.isCacheHit()).isTrue();
            assertThat(second.getStatusCode()).isEqualTo(200);
            assertThat(body(second)).isEqualTo("[1,2,3]");

            backend.verify(1, getRequestedFor(urlEqualTo("/items")));
            assertThat(cache.get("orders:/items")).isPresent();
        }

        @Test
        @DisplayName("does not cache non-200 responses")
        void skipsNonOk() {
            backend.stubFor(get(urlEqualTo("/missing")).willReturn(aResponse().withStatus(404)));

            dispatcher.dispatch("orders", getRequest("/missing"), Deadline.none());
            DispatchResponse second = dispatcher.dispatch("orders", getRequest("/missing"), Deadline.none());

            assertThat(second.getStatusCode()).isEqualTo(404);
            assertThat(second.isCacheHit()).isFalse();
            backend.verify(2, getRequestedFor(urlEqualTo("/missing")));
        }

        @Test
        @DisplayName("never caches non-GET requests")
        void skipsPost() {
            backend.stubFor(post(urlEqualTo("/items")).willReturn(aResponse().withStatus(200).withBody("created")));

            DispatchRequest request = DispatchRequest.builder()
                    .method("POST")
                    .path("/items")
                    .header("Content-Type", List.of("application/json"))
                    .body("{\"id\":1}".getBytes(StandardCharsets.UTF_8))
                    .build();

            dispatcher.dispatch("orders", request, Deadline.none());
            dispatcher.dispatch("orders", request, Deadline.none());

            backend.verify(2, postRequestedFor(urlEqualTo("/items"))
                    .withRequestBody(equalTo("{\"id\":1}")));
            assertThat(cache.size()).isZero();
        }

        @Test
        @DisplayName("cache key includes the query string")
        void queryIsPartOfKey() {
            backend.stubFor(get(urlPathEqualTo("/items")).willReturn(aResponse().withStatus(200).withBody("x")));

            DispatchRequest pageOne = DispatchRequest.builder().method("GET").path("/items").query("page=1").build();
            DispatchRequest pageTwo = DispatchRequest.builder().method("GET").path("/items").query("page=2").build();

            dispatcher.dispatch("orders", pageOne, Deadline.none());
            DispatchResponse second = dispatcher.dispatch("orders", pageTwo, Deadline.none());

            assertThat(second.isCacheHit()).isFalse();
            backend.verify(2, getRequestedFor(urlPathEqualTo("/items")));
        }
    }

    @Nested
    @DisplayName("retries")
    class Retries {

        @Test
        @DisplayName("retries transient statuses until the backend recovers")
        void recoversAfterTransientFailures() {
            backend.stubFor(get(urlEqualTo("/flaky")).inScenario("flaky")
                    .whenScenarioStateIs(Scenario.STARTED)
                    .willReturn(aResponse().withStatus(503))
                    .willSetStateTo("recovered"));
            backend.stubFor(get(urlEqualTo("/flaky")).inScenario("flaky")
                    .whenScenarioStateIs("recovered")
                    .willReturn(aResponse().withStatus(200).withBody("ok")));

            DispatchResponse response = dispatcher.dispatch("orders", getRequest("/flaky"), Deadline.none());

            assertThat(response.getStatusCode()).isEqualTo(200);
            backend.verify(2, getRequestedFor(urlEqualTo("/flaky")));
            assertThat(circuitBreakers.get("orders").getCounts().totalSuccesses()).isEqualTo(1);
        }

        @Test
        @DisplayName("gives up after max attempts and records one breaker failure")
        void exhaustsRetries() {
            backend.stubFor(get(urlEqualTo("/down")).willReturn(aResponse().withStatus(500)));

            assertThatThrownBy(() -> dispatcher.dispatch("orders", getRequest("/down"), Deadline.none()))
                    .isInstanceOf(DispatchFailedException.class)
                    .hasCauseInstanceOf(RetryExhaustedException.class);

            backend.verify(3, getRequestedFor(urlEqualTo("/down")));
            assertThat(circuitBreakers.get("orders").getCounts().totalFailures()).isEqualTo(1);
        }

        @Test
        @DisplayName("relays a client error without retrying")
        void passesThroughClientErrors() {
            backend.stubFor(get(urlEqualTo("/bad")).willReturn(aResponse().withStatus(400).withBody("nope")));

            DispatchResponse response = dispatcher.dispatch("orders", getRequest("/bad"), Deadline.none());

            assertThat(response.getStatusCode()).isEqualTo(400);
            assertThat(body(response)).isEqualTo("nope");
            backend.verify(1, getRequestedFor(urlEqualTo("/bad")));
        }

        @Test
        @DisplayName("a deadline cutting off the only attempt is a cancellation")
        void deadlineDuringLastAttemptIsCancellation() {
            backend.stubFor(get(urlEqualTo("/slow")).willReturn(aResponse().withStatus(200).withFixedDelay(2000)));

            assertThatThrownBy(() -> dispatcher.dispatch("orders", getRequest("/slow"),
                    Deadline.after(Duration.ofMillis(300))))
                    .isInstanceOf(RetryCancelledException.class);

            assertThat(circuitBreakers.get("orders").getCounts().totalFailures()).isEqualTo(1);
        }

        @Test
        @DisplayName("fails when no healthy instance exists")
        void noHealthyInstance() {
            assertThatThrownBy(() -> dispatcher.dispatch("unknown", getRequest("/x"), Deadline.none()))
                    .isInstanceOf(DispatchFailedException.class)
                    .hasMessageContaining("unknown");
        }
    }

    @Nested
    @DisplayName("circuit breaking")
    class CircuitBreaking {

        @Test
        @DisplayName("an open breaker rejects without calling the backend")
        void openBreakerMakesNoCall() {
            backend.stubFor(get(urlEqualTo("/down")).willReturn(aResponse().withStatus(502)));

            for (int i = 0; i < 5; i++) {
                assertThatThrownBy(() -> dispatcher.dispatch("orders", getRequest("/down"), Deadline.none()))
                        .isInstanceOf(DispatchFailedException.class);
            }
            assertThat(circuitBreakers.get("orders").getState()).isEqualTo(CircuitState.OPEN);
            backend.resetRequests();

            assertThatThrownBy(() -> dispatcher.dispatch("orders", getRequest("/down"), Deadline.none()))
                    .isInstanceOf(CircuitOpenException.class);

            backend.verify(0, getRequestedFor(urlEqualTo("/down")));
        }

        @Test
        @DisplayName("a cache hit is served even while the breaker is open")
        void cacheHitBypassesBreaker() {
            backend.stubFor(get(urlEqualTo("/items")).willReturn(aResponse().withStatus(200).withBody("cached")));
            dispatcher.dispatch("orders", getRequest("/items"), Deadline.none());

            backend.stubFor(get(urlEqualTo("/down")).willReturn(aResponse().withStatus(500)));
            for (int i = 0; i < 4; i++) {
                assertThatThrownBy(() -> dispatcher.dispatch("orders", getRequest("/down"), Deadline.none()))
                        .isInstanceOf(DispatchFailedException.class);
            }
            assertThat(circuitBreakers.get("orders").getState()).isEqualTo(CircuitState.OPEN);

            DispatchResponse response = dispatcher.dispatch("orders", getRequest("/items"), Deadline.none());

            assertThat(response.isCacheHit()).isTrue();
            assertThat(body(response)).isEqualTo("cached");
        }
    }

    @Test
    @DisplayName("adds forwarding headers and drops hop-by-hop headers")
    void forwardingHeaders() {
        backend.stubFor(get(urlEqualTo("/whoami")).willReturn(aResponse().withStatus(200)));

        DispatchRequest request = DispatchRequest.builder()
                .method("GET")
                .path("/whoami")
                .header("X-Forwarded-For", List.of("203.0.113.7"))
                .header("X-Request-Id", List.of("abc-123"))
                .header("Connection", List.of("keep-alive"))
                .remoteAddress("10.0.0.9")
                .scheme("https")
                .host("gateway.local")
                .build();

        dispatcher.dispatch("orders", request, Deadline.none());

        backend.verify(getRequestedFor(urlEqualTo("/whoami"))
                .withHeader("X-Forwarded-For", equalTo("203.0.113.7, 10.0.0.9"))
                .withHeader("X-Forwarded-Proto", equalTo("https"))
                .withHeader("X-Forwarded-Host", equalTo("gateway.local"))
                .withHeader("X-Request-Id", equalTo("abc-123")));
    }
}
