package com.relay.proxy;

import com.relay.control.EndpointRateLimiterRegistry;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
public class RateLimitFilter implements Filter {

    static final String RETRY_AFTER_SECONDS = "60";

    private final EndpointRateLimiterRegistry rateLimiters;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        if (!(request instanceof HttpServletRequest httpRequest) ||
            !(response instanceof HttpServletResponse httpResponse)) {
            chain.doFilter(request, response);
            return;
        }

        String clientKey = ClientIdentity.resolve(httpRequest);
        String path = httpRequest.getRequestURI();

        if (!rateLimiters.allow(path, clientKey)) {
            log.warn("Rate limit exceeded for client {} on {}", clientKey, path);
            httpResponse.setHeader("Retry-After", RETRY_AFTER_SECONDS);
            DenialResponses.write(httpResponse, 429, DenialResponses.RATE_LIMITED);
            return;
        }

        chain.doFilter(request, response);
    }
}
