package com.vcc.router.service.policy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.router.config.RouterProperties;
import com.vcc.router.entity.PolicyVersionEntity;
import com.vcc.router.exception.InvalidPolicyException;
import com.vcc.router.model.Policy;
import com.vcc.router.repository.PolicyVersionRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active policy version per app. Policies are loaded from JSON documents at startup
 * and, when the database store is enabled, from the latest rows of policy_version.
 * Publishing swaps in a new snapshot atomically; requests that already captured the previous
 * snapshot keep evaluating against it.
 */
@Service
public class PolicyService {
    private static final Logger log = LoggerFactory.getLogger(PolicyService.class);

    private final RouterProperties properties;
    private final PolicyVersionRepository repository;
    private final PolicyValidator validator;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();

    private final AtomicReference<Map<String, Policy>> activeRef = new AtomicReference<>(Map.of());
    // Every accepted version per app, kept for audit lookups
    private final Map<String, NavigableMap<Long, Policy>> history = new ConcurrentHashMap<>();

    public PolicyService(RouterProperties properties,
                         PolicyVersionRepository repository,
                         PolicyValidator validator,
                         ObjectMapper objectMapper,
                         Clock clock) {
        this.properties = properties;
        this.repository = repository;
        this.validator = validator;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        loadPolicies()
                .doOnSuccess(count -> log.info("Loaded {} active policies", count))
                .doOnError(e -> log.error("Failed to load policies: {}", e.getMessage()))
                .block();
    }

    /**
     * Load policy documents from the configured locations and the database. Invalid documents are
     * logged and skipped; for each app the highest valid version wins.
     */
    public Mono<Integer> loadPolicies() {
        Map<String, Policy> loaded = new HashMap<>();
        for (String location : properties.getPolicyLocations()) {
            for (Policy policy : readLocation(location)) {
                accept(loaded, policy, location);
            }
        }

        Mono<Void> dbLoad = Mono.empty();
        if (properties.getStore().isUseDatabase()) {
            dbLoad = repository.findLatestVersions()
                    .doOnNext(entity -> {
                        try {
                            accept(loaded, objectMapper.readValue(entity.getDocument(), Policy.class),
                                    "policy_version#" + entity.getId());
                        } catch (JsonProcessingException e) {
                            log.warn("Skipping unreadable policy row: appId={}, version={}, error={}",
                                    entity.getAppId(), entity.getVersion(), e.getOriginalMessage());
                        }
                    })
                    .then();
        }

        return dbLoad.then(Mono.fromCallable(() -> {
            activeRef.set(Map.copyOf(loaded));
            return loaded.size();
        }));
    }

    private List<Policy> readLocation(String location) {
        try {
            Resource[] resources = resolver.getResources(location);
            List<Policy> policies = new ArrayList<>();
            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    policies.add(objectMapper.readValue(in, Policy.class));
                } catch (IOException e) {
                    log.warn("Skipping unreadable policy document {}: {}", resource.getDescription(), e.getMessage());
                }
            }
            return policies;
        } catch (IOException e) {
            log.warn("Cannot resolve policy location {}: {}", location, e.getMessage());
            return List.of();
        }
    }

    private void accept(Map<String, Policy> loaded, Policy policy, String source) {
        try {
            validator.validate(policy);
        } catch (InvalidPolicyException e) {
            log.warn("Rejected policy from {}: appId={}, violations={}", source, policy.appId(), e.getViolations());
            return;
        }
        recordHistory(policy);
        Policy current = loaded.get(policy.appId());
        if (current == null || policy.version() > current.version()) {
            loaded.put(policy.appId(), policy);
            log.debug("Policy candidate appId={} version={} from {}", policy.appId(), policy.version(), source);
        }
    }

    /**
     * Validate, persist and activate a new policy version. Fails with {@link InvalidPolicyException}
     * when the document is invalid or does not supersede the active version.
     */
    public Mono<Policy> publish(Policy policy, String actor) {
        return Mono.fromCallable(() -> {
                    validator.validate(policy);
                    Policy current = activeRef.get().get(policy.appId());
                    if (current != null && policy.version() <= current.version()) {
                        throw new InvalidPolicyException(policy.appId(), List.of(
                                "version " + policy.version() + " does not supersede active version " + current.version()));
                    }
                    return policy;
                })
                .flatMap(validated -> persist(validated, actor).thenReturn(validated))
                .map(validated -> {
                    activate(validated);
                    return validated;
                });
    }

    private Mono<Void> persist(Policy policy, String actor) {
        if (!properties.getStore().isUseDatabase()) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> {
                    PolicyVersionEntity entity = new PolicyVersionEntity();
                    entity.setAppId(policy.appId());
                    entity.setVersion(policy.version());
                    entity.setDocument(objectMapper.writeValueAsString(policy));
                    entity.setCreatedBy(actor);
                    entity.setCreatedAt(clock.instant());
                    return entity;
                })
                .flatMap(repository::save)
                .doOnSuccess(saved -> log.debug("Persisted policy appId={} version={} id={}",
                        saved.getAppId(), saved.getVersion(), saved.getId()))
                .then();
    }

    private void activate(Policy policy) {
        while (true) {
            Map<String, Policy> current = activeRef.get();
            Policy active = current.get(policy.appId());
            if (active != null && policy.version() <= active.version()) {
                throw new InvalidPolicyException(policy.appId(), List.of(
                        "version " + policy.version() + " was superseded by concurrent publish of version "
                                + active.version()));
            }
            Map<String, Policy> next = new HashMap<>(current);
            next.put(policy.appId(), policy);
            if (activeRef.compareAndSet(current, Map.copyOf(next))) {
                recordHistory(policy);
                log.info("Activated policy appId={} version={} rules={}",
                        policy.appId(), policy.version(), policy.rules().size());
                return;
            }
        }
    }

    private void recordHistory(Policy policy) {
        history.computeIfAbsent(policy.appId(), k -> new ConcurrentSkipListMap<>())
                .put(policy.version(), policy);
    }

    public Optional<Policy> active(String appId) {
        if (appId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(activeRef.get().get(appId));
    }

    /**
     * Snapshot of every active policy, keyed by app.
     */
    public Map<String, Policy> snapshot() {
        return activeRef.get();
    }

    /**
     * A previously accepted version, for resolving historical decision traces.
     */
    public Optional<Policy> version(String appId, long version) {
        NavigableMap<Long, Policy> versions = history.get(appId);
        return versions != null ? Optional.ofNullable(versions.get(version)) : Optional.empty();
    }

    public List<Long> versions(String appId) {
        NavigableMap<Long, Policy> versions = history.get(appId);
        return versions != null ? List.copyOf(versions.keySet()) : List.of();
    }
}
