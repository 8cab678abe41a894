package com.relay.control;

import com.relay.model.ServiceInstance;
import com.relay.proxy.ServiceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Slf4j
@Component
@ConditionalOnProperty(name = "relay.discovery.health-check.enabled", havingValue = "true")
public class HealthProber {

    private final ServiceRegistry serviceRegistry;
    private final HttpClient httpClient;
    private final String healthPath;
    private final Duration probeTimeout;

    private volatile Instant lastExecution;

    @Autowired
    public HealthProber(ServiceRegistry serviceRegistry,
                        @Value("${relay.discovery.health-check.path:/health}") String healthPath,
                        @Value("${relay.discovery.health-check.timeout-ms:2000}") long timeoutMs) {
        this(serviceRegistry, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(timeoutMs))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build(), healthPath, Duration.ofMillis(timeoutMs));
    }

    HealthProber(ServiceRegistry serviceRegistry, HttpClient httpClient, String healthPath, Duration probeTimeout) {
        this.serviceRegistry = serviceRegistry;
        this.httpClient = httpClient;
        this.healthPath = healthPath.startsWith("/") ? healthPath : "/" + healthPath;
        this.probeTimeout = probeTimeout;
    }

    @Scheduled(fixedDelayString = "${relay.discovery.health-check.interval-ms:10000}")
    public void probeAll() {
        lastExecution = Instant.now();

        List<ServiceInstance> instances = serviceRegistry.getAllInstances();
        if (instances.isEmpty()) {
            log.debug("No instances registered, skipping health probe");
            return;
        }

        int healthy = 0;
        for (ServiceInstance instance : instances) {
            if (probe(instance)) {
                healthy++;
            }
        }
        log.debug("Health probe complete: {}/{} instances healthy", healthy, instances.size());
    }

    boolean probe(ServiceInstance instance) {
        boolean up = isUp(instance);
        if (instance.markHealthy(up)) {
            if (up) {
                log.info("Instance {}/{} is healthy again", instance.getServiceName(), instance.getId());
            } else {
                log.warn("Instance {}/{} failed health check at {}",
                        instance.getServiceName(), instance.getId(), instance.getUrl() + healthPath);
            }
        }
        return up;
    }

    private boolean isUp(ServiceInstance instance) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(instance.getUrl() + healthPath))
                .timeout(probeTimeout)
                .GET()
                .build();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            return response.statusCode() >= 200 && response.statusCode() < 300;
        } catch (IOException e) {
            log.debug("Health probe to {} failed: {}", instance.getUrl(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return instance.isHealthy();
        }
    }

    public Instant getLastExecution() {
        return lastExecution;
    }
}
