package com.relay.proxy;

import com.relay.control.Deadline;
import com.relay.exception.RetryCancelledException;
import com.relay.exception.TransportException;
import com.relay.model.DispatchRequest;
import com.relay.model.DispatchResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
public class BackendClient {

    static final String FORWARDED_FOR = "X-Forwarded-For";
    static final String FORWARDED_PROTO = "X-Forwarded-Proto";
    static final String FORWARDED_HOST = "X-Forwarded-Host";

    // hop-by-hop, or refused by java.net.http
    private static final Set<String> SKIPPED_REQUEST_HEADERS = Set.of(
            "connection", "content-length", "expect", "host", "upgrade", "keep-alive",
            "proxy-connection", "te", "trailer", "transfer-encoding", "http2-settings");

    private static final Set<String> SKIPPED_RESPONSE_HEADERS = Set.of(
            "connection", "keep-alive", "transfer-encoding", ":status");

    private static final Duration MIN_TIMEOUT = Duration.ofMillis(1);

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public BackendClient(Duration connectTimeout, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build(), requestTimeout);

        log.info("BackendClient initialized with {}ms connect timeout, {}ms request timeout",
                connectTimeout.toMillis(), requestTimeout.toMillis());
    }

    BackendClient(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    public DispatchResponse send(String baseUrl, DispatchRequest request, Deadline deadline) {
        if (deadline.isExpired()) {
            throw new RetryCancelledException("Deadline exceeded before calling " + baseUrl);
        }

        Duration timeout = deadline.cap(requestTimeout);
        boolean cutByDeadline = timeout.compareTo(requestTimeout) < 0;
        if (timeout.compareTo(MIN_TIMEOUT) < 0) {
            timeout = MIN_TIMEOUT;
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + request.pathWithQuery()))
                .timeout(timeout)
                .method(request.getMethod().toUpperCase(), bodyOf(request));

        copyHeaders(request, builder);
        addForwardingHeaders(request, builder);

        try {
            HttpResponse<byte[]> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
            return toDispatchResponse(response);

        } catch (HttpTimeoutException e) {
            if (cutByDeadline || deadline.isExpired()) {
                throw new RetryCancelledException("Deadline exceeded while calling " + baseUrl, e);
            }
            throw new TransportException("Request to " + baseUrl + " timed out", e);

        } catch (IOException e) {
            throw new TransportException("Request to " + baseUrl + " failed: " + e.getMessage(), e);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryCancelledException("Interrupted while calling " + baseUrl, e);
        }
    }

    private static HttpRequest.BodyPublisher bodyOf(DispatchRequest request) {
        byte[] body = request.getBody();
        if (body == null || body.length == 0) {
            return HttpRequest.BodyPublishers.noBody();
        }
        return HttpRequest.BodyPublishers.ofByteArray(body);
    }

    private static void copyHeaders(DispatchRequest request, HttpRequest.Builder builder) {
        for (Map.Entry<String, List<String>> header : request.getHeaders().entrySet()) {
            String name = header.getKey().toLowerCase();
            if (SKIPPED_REQUEST_HEADERS.contains(name) || isForwardingHeader(name)) {
                continue;
            }
            header.getValue().forEach(value -> builder.header(header.getKey(), value));
        }
    }

    private static void addForwardingHeaders(DispatchRequest request, HttpRequest.Builder builder) {
        String forwardedFor = request.firstHeader(FORWARDED_FOR);
        String remote = request.getRemoteAddress();
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            builder.header(FORWARDED_FOR, remote != null ? forwardedFor + ", " + remote : forwardedFor);
        } else if (remote != null) {
            builder.header(FORWARDED_FOR, remote);
        }

        String proto = request.firstHeader(FORWARDED_PROTO);
        if (proto == null) {
            proto = request.getScheme();
        }
        if (proto != null) {
            builder.header(FORWARDED_PROTO, proto);
        }

        String host = request.firstHeader(FORWARDED_HOST);
        if (host == null) {
            host = request.getHost();
        }
        if (host != null) {
            builder.header(FORWARDED_HOST, host);
        }
    }

    private static boolean isForwardingHeader(String lowerCaseName) {
        return lowerCaseName.equals("x-forwarded-for")
                || lowerCaseName.equals("x-forwarded-proto")
                || lowerCaseName.equals("x-forwarded-host");
    }

    private static DispatchResponse toDispatchResponse(HttpResponse<byte[]> response) {
        DispatchResponse.DispatchResponseBuilder builder = DispatchResponse.builder()
                .statusCode(response.statusCode())
                .body(response.body())
                .contentType(response.headers().firstValue("Content-Type").orElse(null))
                .cacheHit(false);

        response.headers().map().forEach((name, values) -> {
            if (!SKIPPED_RESPONSE_HEADERS.contains(name.toLowerCase())) {
                builder.header(name, values);
            }
        });

        return builder.build();
    }
}
