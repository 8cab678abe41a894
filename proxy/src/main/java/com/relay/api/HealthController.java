package com.relay.api;

import com.relay.proxy.ServiceRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final ServiceRegistry serviceRegistry;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, String> services = new LinkedHashMap<>();
        boolean allUp = true;

        for (String service : serviceRegistry.getServiceNames()) {
            boolean up = !serviceRegistry.getHealthyInstances(service).isEmpty();
            services.put(service, up ? "OK" : "UNAVAILABLE");
            allUp &= up;
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("gateway", "OK");
        body.put("services", services);

        return ResponseEntity.status(allUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
