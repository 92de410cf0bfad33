package com.knowledgeassist.api.controller;

import com.knowledgeassist.api.model.HealthResponse;
import com.knowledgeassist.api.persistence.repository.TenantRepository;
import com.knowledgeassist.api.service.retrieval.VectorIndex;
import com.knowledgeassist.api.service.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;

@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    static final String HEALTHY = "healthy";
    static final String UNHEALTHY = "unhealthy";
    static final String DEGRADED = "degraded";

    private final TenantRepository tenantRepository;
    private final KeyValueStore keyValueStore;
    private final VectorIndex vectorIndex;

    public HealthController(TenantRepository tenantRepository, KeyValueStore keyValueStore, VectorIndex vectorIndex) {
        this.tenantRepository = tenantRepository;
        this.keyValueStore = keyValueStore;
        this.vectorIndex = vectorIndex;
    }

    @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<HealthResponse> health() {
        return Mono.fromCallable(this::check).subscribeOn(Schedulers.boundedElastic());
    }

    private HealthResponse check() {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("api", HEALTHY);
        services.put("database", probe("database", () -> {
            tenantRepository.count();
            return true;
        }));
        services.put("redis", probe("redis", keyValueStore::isAvailable));
        services.put("qdrant", probe("qdrant", vectorIndex::isAvailable));
        boolean allHealthy = services.values().stream().allMatch(HEALTHY::equals);
        return new HealthResponse(allHealthy ? HEALTHY : DEGRADED, services);
    }

    private String probe(String name, BooleanSupplier check) {
        try {
            return check.getAsBoolean() ? HEALTHY : UNHEALTHY;
        } catch (RuntimeException ex) {
            log.warn("Health check for {} failed: {}", name, ex.getMessage());
            return UNHEALTHY;
        }
    }
}
