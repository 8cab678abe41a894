package com.relay.api;

import com.relay.control.CircuitBreaker;
import com.relay.control.CircuitBreakerRegistry;
import com.relay.control.CircuitCounts;
import com.relay.exception.ServiceNotFoundException;
import com.relay.model.ServiceInstance;
import com.relay.proxy.ServiceRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/admin/services")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ServiceController {

    private final ServiceRegistry serviceRegistry;
    private final CircuitBreakerRegistry circuitBreakers;

    @GetMapping
    public ResponseEntity<List<ServiceInfo>> getAllServices() {
        var services = serviceRegistry.getServiceNames().stream()
                .map(this::toInfo)
                .toList();

        return ResponseEntity.ok(services);
    }

    @GetMapping("/{service}")
    public ResponseEntity<ServiceInfo> getService(@PathVariable String service) {
        if (!serviceRegistry.contains(service)) {
            throw new ServiceNotFoundException(service);
        }
        return ResponseEntity.ok(toInfo(service));
    }

    @PostMapping("/{service}/instances")
    public ResponseEntity<InstanceInfo> addInstance(@PathVariable String service,
                                                    @RequestBody AddInstanceRequest request) {
        if (request.url() == null || request.url().isBlank()) {
            throw new IllegalArgumentException("Instance URL is required");
        }

        String id = request.id() != null && !request.id().isBlank()
                ? request.id()
                : service + "-" + (serviceRegistry.getInstances(service).size() + 1);
        int weight = request.weight() != null ? request.weight() : 100;

        ServiceInstance instance = serviceRegistry.register(service, id, request.url(), weight);

        return ResponseEntity.status(HttpStatus.CREATED).body(InstanceInfo.of(instance));
    }

    @DeleteMapping("/{service}/instances/{id}")
    public ResponseEntity<Void> removeInstance(@PathVariable String service, @PathVariable String id) {
        boolean removed = serviceRegistry.deregister(service, id);

        if (!removed) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{service}/circuit/reset")
    public ResponseEntity<CircuitInfo> resetCircuit(@PathVariable String service) {
        var breaker = circuitBreakers.find(service);
        if (breaker.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        breaker.get().reset();
        log.info("Circuit breaker reset by operator: {}", service);
        return ResponseEntity.ok(CircuitInfo.of(breaker.get()));
    }

    private ServiceInfo toInfo(String service) {
        var instances = serviceRegistry.getInstances(service).stream()
                .map(InstanceInfo::of)
                .toList();
        var circuit = circuitBreakers.find(service)
                .map(CircuitInfo::of)
                .orElse(null);
        return new ServiceInfo(service, instances, circuit);
    }

    public record AddInstanceRequest(String id, String url, Integer weight) {}

    public record ServiceInfo(String name, List<InstanceInfo> instances, CircuitInfo circuit) {}

    public record InstanceInfo(String id, String url, int weight, boolean healthy) {
        static InstanceInfo of(ServiceInstance instance) {
            return new InstanceInfo(instance.getId(), instance.getUrl(), instance.getWeight(), instance.isHealthy());
        }
    }

    public record CircuitInfo(String state, long requests, long successes, long failures) {
        static CircuitInfo of(CircuitBreaker breaker) {
            CircuitCounts counts = breaker.getCounts();
            return new CircuitInfo(breaker.getState().name(),
                    counts.requests(), counts.totalSuccesses(), counts.totalFailures());
        }
    }
}
