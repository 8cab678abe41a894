package com.relay.proxy;

import com.relay.config.RelayProperties;
import com.relay.control.Deadline;
import com.relay.exception.CircuitBreakerRejectedException;
import com.relay.exception.DispatchFailedException;
import com.relay.exception.RetryCancelledException;
import com.relay.metrics.DispatchMetrics;
import com.relay.model.DispatchRequest;
import com.relay.model.DispatchResponse;
import com.relay.model.RouteMatch;
import io.micrometer.core.instrument.Timer;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class ProxyFilter implements Filter {

    static final String CACHE_HEADER = "X-Cache";

    private final RouteTable routeTable;
    private final ResilientDispatcher dispatcher;
    private final DispatchMetrics metrics;
    private final Duration dispatchTimeout;

    public ProxyFilter(RouteTable routeTable, ResilientDispatcher dispatcher,
                       DispatchMetrics metrics, RelayProperties properties) {
        this.routeTable = routeTable;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.dispatchTimeout = properties.getDispatch().getTimeout();
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        if (!(request instanceof HttpServletRequest httpRequest) ||
            !(response instanceof HttpServletResponse httpResponse)) {
            chain.doFilter(request, response);
            return;
        }

        String requestPath = httpRequest.getRequestURI();
        String method = httpRequest.getMethod();

        String upgrade = httpRequest.getHeader("Upgrade");
        if ("websocket".equalsIgnoreCase(upgrade) || isGatewayEndpoint(requestPath)) {
            chain.doFilter(request, response);
            return;
        }

        Optional<RouteMatch> match = routeTable.match(requestPath);
        if (match.isEmpty()) {
            chain.doFilter(request, response);
            return;
        }

        RouteMatch route = match.get();
        log.debug("Routing {} {} to service {}", method, requestPath, route.serviceName());

        String service = route.serviceName();
        DispatchRequest dispatchRequest = toDispatchRequest(httpRequest, route.forwardPath());
        Timer.Sample sample = metrics.start();

        int status;
        DispatchMetrics.Outcome outcome;
        try {
            DispatchResponse result = dispatcher.dispatch(service, dispatchRequest, Deadline.after(dispatchTimeout));
            writeResponse(httpResponse, result);
            status = result.getStatusCode();
            outcome = result.isCacheHit() ? DispatchMetrics.Outcome.CACHE_HIT : DispatchMetrics.Outcome.SUCCESS;

        } catch (CircuitBreakerRejectedException e) {
            log.warn("Circuit breaker {} for service {}", e.getState(), service);
            metrics.recordRejection(service, e.getState());
            DenialResponses.write(httpResponse, 503, DenialResponses.SERVICE_UNAVAILABLE);
            status = 503;
            outcome = DispatchMetrics.Outcome.CIRCUIT_REJECTED;

        } catch (RetryCancelledException e) {
            DenialResponses.write(httpResponse, 504, DenialResponses.GATEWAY_TIMEOUT);
            status = 504;
            outcome = DispatchMetrics.Outcome.CANCELLED;

        } catch (DispatchFailedException e) {
            DenialResponses.write(httpResponse, 502, DenialResponses.SERVICE_ERROR);
            status = 502;
            outcome = DispatchMetrics.Outcome.FAILED;
        }

        if (dispatchRequest.isCacheEligible()) {
            metrics.recordCacheLookup(service, outcome == DispatchMetrics.Outcome.CACHE_HIT);
        }
        metrics.recordRequest(sample, service, method, status, outcome);
    }

    private static boolean isGatewayEndpoint(String path) {
        return path.startsWith("/admin/")
                || path.startsWith("/actuator/")
                || path.startsWith("/websocket/")
                || path.equals("/health");
    }

    private static DispatchRequest toDispatchRequest(HttpServletRequest request, String forwardPath)
            throws IOException {

        DispatchRequest.DispatchRequestBuilder builder = DispatchRequest.builder()
                .method(request.getMethod())
                .path(forwardPath)
                .query(request.getQueryString())
                .remoteAddress(request.getRemoteAddr())
                .scheme(request.getScheme())
                .host(request.getHeader("Host") != null ? request.getHeader("Host") : request.getServerName());

        for (String name : Collections.list(request.getHeaderNames())) {
            builder.header(name, Collections.list(request.getHeaders(name)));
        }

        if (hasBody(request)) {
            builder.body(request.getInputStream().readAllBytes());
        }

        return builder.build();
    }

    private static boolean hasBody(HttpServletRequest request) {
        return request.getContentLengthLong() > 0
                || "chunked".equalsIgnoreCase(request.getHeader("Transfer-Encoding"));
    }

    private static void writeResponse(HttpServletResponse response, DispatchResponse result) throws IOException {
        response.setStatus(result.getStatusCode());

        for (Map.Entry<String, List<String>> header : result.getHeaders().entrySet()) {
            String name = header.getKey();
            if (name.equalsIgnoreCase("Content-Length") || name.equalsIgnoreCase("Content-Type")) {
                continue;
            }
            header.getValue().forEach(value -> response.addHeader(name, value));
        }

        if (result.getContentType() != null) {
            response.setContentType(result.getContentType());
        }
        response.setHeader(CACHE_HEADER, result.isCacheHit() ? "HIT" : "MISS");

        byte[] body = result.getBody();
        if (body != null && body.length > 0) {
            response.setContentLength(body.length);
            response.getOutputStream().write(body);
        }
    }
}
