package com.vcc.router.service.subscription;

import com.vcc.router.model.Subscription;
import com.vcc.router.model.SubscriptionScope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of all subscriptions, indexed by scope and target.
 */
public final class SubscriptionSnapshot {

    private static final SubscriptionSnapshot EMPTY = new SubscriptionSnapshot(List.of());

    private final Map<SubscriptionScope, Map<String, List<Subscription>>> index;
    private final List<Subscription> all;

    private SubscriptionSnapshot(Collection<Subscription> subscriptions) {
        Map<SubscriptionScope, Map<String, List<Subscription>>> built = new EnumMap<>(SubscriptionScope.class);
        for (Subscription subscription : subscriptions) {
            built.computeIfAbsent(subscription.scope(), s -> new HashMap<>())
                    .computeIfAbsent(subscription.targetId(), t -> new ArrayList<>())
                    .add(subscription);
        }
        Map<SubscriptionScope, Map<String, List<Subscription>>> frozen = new EnumMap<>(SubscriptionScope.class);
        built.forEach((scope, byTarget) -> {
            Map<String, List<Subscription>> copy = new HashMap<>();
            byTarget.forEach((target, list) -> copy.put(target, List.copyOf(list)));
            frozen.put(scope, Map.copyOf(copy));
        });
        this.index = frozen;
        this.all = List.copyOf(subscriptions);
    }

    public static SubscriptionSnapshot empty() {
        return EMPTY;
    }

    public static SubscriptionSnapshot of(Collection<Subscription> subscriptions) {
        return new SubscriptionSnapshot(subscriptions);
    }

    /**
     * Subscriptions registered for the target, enabled or not.
     */
    public List<Subscription> find(SubscriptionScope scope, String targetId) {
        if (scope == null || targetId == null) {
            return List.of();
        }
        Map<String, List<Subscription>> byTarget = index.get(scope);
        if (byTarget == null) {
            return List.of();
        }
        return byTarget.getOrDefault(targetId, List.of());
    }

    public List<Subscription> enabled(SubscriptionScope scope, String targetId) {
        return find(scope, targetId).stream().filter(Subscription::enabled).toList();
    }

    public List<Subscription> all() {
        return all;
    }

    /**
     * New snapshot where the subscription replaces any existing one for the same scope and target.
     */
    public SubscriptionSnapshot with(Subscription subscription) {
        List<Subscription> next = new ArrayList<>();
        for (Subscription existing : all) {
            if (existing.scope() != subscription.scope() || !existing.targetId().equals(subscription.targetId())) {
                next.add(existing);
            }
        }
        next.add(subscription);
        return new SubscriptionSnapshot(next);
    }

    public int size() {
        return all.size();
    }
}
