package com.example.toolgateway.backend;

import com.example.toolgateway.domain.Connection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of backend client factories, keyed by connection kind.
 */
@Slf4j
@Component
public class BackendClientRegistry {

    private final Map<String, BackendClientFactory> factories = new ConcurrentHashMap<>();

    public BackendClientRegistry(List<BackendClientFactory> discovered) {
        discovered.forEach(this::register);
    }

    public void register(BackendClientFactory factory) {
        factories.put(factory.getKind(), factory);
        log.info("Registered backend kind: {}", factory.getKind());
    }

    public boolean supports(String kind) {
        return kind != null && factories.containsKey(kind);
    }

    public Optional<BackendClientFactory> getFactory(String kind) {
        return Optional.ofNullable(kind).map(factories::get);
    }

    /**
     * Build an unconnected client for the connection's kind.
     */
    public BackendClient create(Connection connection, Map<String, Object> config, Map<String, Object> credentials) {
        BackendClientFactory factory = getFactory(connection.getKind())
                .orElseThrow(() -> new IllegalArgumentException("Unsupported connection kind: " + connection.getKind()));
        return factory.create(connection, config, credentials);
    }

    public List<String> defaultToolNames(String kind) {
        return getFactory(kind).map(BackendClientFactory::defaultToolNames).orElse(List.of());
    }

    public Set<String> getKinds() {
        return new TreeSet<>(factories.keySet());
    }
}
