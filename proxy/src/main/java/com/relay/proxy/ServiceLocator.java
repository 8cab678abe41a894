package com.relay.proxy;

import java.util.List;

public interface ServiceLocator {

    String resolveHealthy(String serviceName);

    List<String> resolveAll(String serviceName);
}
