package com.relay.proxy;

import com.relay.control.PathPrefixes;
import com.relay.model.RouteEntry;
import com.relay.model.RouteMatch;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Slf4j
public class RouteTable {

    private final List<RouteEntry> routes;

    public RouteTable(List<RouteEntry> entries) {
        this.routes = entries.stream()
                .map(RouteTable::normalized)
                .sorted(Comparator.comparingInt((RouteEntry r) -> r.getPathPrefix().length()).reversed())
                .toList();

        routes.forEach(route -> log.info("Registered route: {} -> {}", displayPrefix(route), route.getServiceName()));
    }

    public Optional<RouteMatch> match(String path) {
        for (RouteEntry route : routes) {
            if (PathPrefixes.matches(route.getPathPrefix(), path)) {
                return Optional.of(new RouteMatch(route, forwardPath(route, path)));
            }
        }
        return Optional.empty();
    }

    public List<RouteEntry> getRoutes() {
        return routes;
    }

    private static String forwardPath(RouteEntry route, String path) {
        if (!route.isStripPrefix()) {
            return path;
        }
        String remainder = path.substring(route.getPathPrefix().length());
        if (!remainder.startsWith("/")) {
            remainder = "/" + remainder;
        }
        return remainder;
    }

    private static RouteEntry normalized(RouteEntry entry) {
        if (entry.getServiceName() == null || entry.getServiceName().isBlank()) {
            throw new IllegalArgumentException("Route " + entry.getPathPrefix() + " has no service name");
        }
        return RouteEntry.builder()
                .pathPrefix(PathPrefixes.normalize(entry.getPathPrefix()))
                .serviceName(entry.getServiceName())
                .stripPrefix(entry.isStripPrefix())
                .rateLimit(entry.getRateLimit())
                .build();
    }

    private static String displayPrefix(RouteEntry route) {
        return route.getPathPrefix().isEmpty() ? "/" : route.getPathPrefix();
    }
}
