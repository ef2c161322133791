package com.vcc.router.service.subscription;

import com.vcc.router.config.RouterProperties;
import com.vcc.router.entity.SubscriptionEntity;
import com.vcc.router.model.Subscription;
import com.vcc.router.repository.SubscriptionRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Subscription store. YAML entries seed the snapshot; database rows, when enabled, replace seeded
 * entries for the same scope and target. Updates publish a new snapshot for subsequent requests.
 */
@Service
public class SubscriptionService {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    private final RouterProperties properties;
    private final SubscriptionRepository repository;
    private final Clock clock;
    private final boolean useDatabase;

    private final AtomicReference<SubscriptionSnapshot> snapshotRef =
            new AtomicReference<>(SubscriptionSnapshot.empty());

    public SubscriptionService(RouterProperties properties, SubscriptionRepository repository, Clock clock) {
        this.properties = properties;
        this.repository = repository;
        this.clock = clock;
        this.useDatabase = properties.getStore().isUseDatabase();
    }

    @PostConstruct
    public void init() {
        loadSubscriptions()
                .doOnSuccess(count -> log.info("Loaded {} subscriptions (useDatabase={})", count, useDatabase))
                .doOnError(e -> log.error("Failed to load subscriptions: {}", e.getMessage()))
                .block();
    }

    public Mono<Integer> loadSubscriptions() {
        List<Subscription> seed = new ArrayList<>();
        for (RouterProperties.SubscriptionConfig config : properties.getSubscriptions()) {
            seed.add(config.toSubscription());
        }
        Mono<SubscriptionSnapshot> loaded = Mono.just(SubscriptionSnapshot.of(seed));
        if (useDatabase) {
            loaded = repository.findAll()
                    .map(SubscriptionEntity::toSubscription)
                    .reduce(SubscriptionSnapshot.of(seed), SubscriptionSnapshot::with);
        }
        return loaded.map(snapshot -> {
            snapshotRef.set(snapshot);
            return snapshot.size();
        });
    }

    public SubscriptionSnapshot current() {
        return snapshotRef.get();
    }

    /**
     * Create or replace the subscription for its scope and target.
     */
    public Mono<Subscription> upsert(Subscription subscription) {
        return persist(subscription)
                .thenReturn(subscription)
                .doOnNext(saved -> {
                    snapshotRef.updateAndGet(snapshot -> snapshot.with(saved));
                    log.info("Subscription updated: scope={}, target={}, models={}, enabled={}",
                            saved.scope(), saved.targetId(), saved.models(), saved.enabled());
                });
    }

    private Mono<Void> persist(Subscription subscription) {
        if (!useDatabase) {
            return Mono.empty();
        }
        Instant now = clock.instant();
        return repository.findByScopeAndTargetId(subscription.scope().name(), subscription.targetId())
                .map(existing -> {
                    SubscriptionEntity updated = SubscriptionEntity.fromSubscription(subscription);
                    updated.setId(existing.getId());
                    updated.setCreatedAt(existing.getCreatedAt());
                    updated.setUpdatedAt(now);
                    return updated;
                })
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    SubscriptionEntity created = SubscriptionEntity.fromSubscription(subscription);
                    created.setCreatedAt(now);
                    created.setUpdatedAt(now);
                    return created;
                }))
                .flatMap(repository::save)
                .then();
    }
}
