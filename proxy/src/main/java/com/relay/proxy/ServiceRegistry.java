package com.relay.proxy;

import com.relay.exception.ServiceNotFoundException;
import com.relay.model.ServiceInstance;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

@Slf4j
public class ServiceRegistry implements ServiceLocator {

    private final Map<String, Map<String, ServiceInstance>> services = new ConcurrentHashMap<>();

    public ServiceInstance register(String serviceName, String id, String url, int weight) {
        ServiceInstance instance = new ServiceInstance(id, serviceName, url, weight);
        services.computeIfAbsent(serviceName, name -> new ConcurrentHashMap<>()).put(id, instance);
        log.info("Registered instance: {}/{} at {} with weight {}", serviceName, id, url, weight);
        return instance;
    }

    public boolean deregister(String serviceName, String id) {
        Map<String, ServiceInstance> instances = services.get(serviceName);
        if (instances == null || instances.remove(id) == null) {
            return false;
        }
        log.info("Removed instance: {}/{}", serviceName, id);
        return true;
    }

    public Optional<ServiceInstance> getInstance(String serviceName, String id) {
        Map<String, ServiceInstance> instances = services.get(serviceName);
        return instances == null ? Optional.empty() : Optional.ofNullable(instances.get(id));
    }

    public List<ServiceInstance> getInstances(String serviceName) {
        Map<String, ServiceInstance> instances = services.get(serviceName);
        return instances == null ? List.of() : new ArrayList<>(instances.values());
    }

    public List<ServiceInstance> getHealthyInstances(String serviceName) {
        return getInstances(serviceName).stream()
                .filter(ServiceInstance::isHealthy)
                .toList();
    }

    public List<ServiceInstance> getAllInstances() {
        return services.values().stream()
                .flatMap(instances -> instances.values().stream())
                .toList();
    }

    public Set<String> getServiceNames() {
        return new TreeSet<>(services.keySet());
    }

    public boolean contains(String serviceName) {
        return services.containsKey(serviceName);
    }

    @Override
    public String resolveHealthy(String serviceName) {
        List<ServiceInstance> healthy = getHealthyInstances(serviceName);
        if (healthy.isEmpty()) {
            log.warn("No healthy instances for service: {}", serviceName);
            throw new ServiceNotFoundException(serviceName);
        }
        return select(healthy).getUrl();
    }

    @Override
    public List<String> resolveAll(String serviceName) {
        List<String> urls = getHealthyInstances(serviceName).stream()
                .map(ServiceInstance::getUrl)
                .toList();
        if (urls.isEmpty()) {
            throw new ServiceNotFoundException(serviceName);
        }
        return urls;
    }

    private ServiceInstance select(List<ServiceInstance> candidates) {
        if (candidates.size() == 1) {
            return candidates.get(0);
        }

        int totalWeight = candidates.stream()
                .mapToInt(ServiceInstance::getWeight)
                .sum();

        if (totalWeight == 0) {
            return candidates.get(ThreadLocalRandom.current().nextInt(candidates.size()));
        }

        int random = ThreadLocalRandom.current().nextInt(totalWeight);
        int currentSum = 0;

        for (ServiceInstance instance : candidates) {
            currentSum += instance.getWeight();
            if (random < currentSum) {
                return instance;
            }
        }

        return candidates.get(candidates.size() - 1);
    }
}
