package com.vcc.router.repository;

import com.vcc.router.entity.SubscriptionEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface SubscriptionRepository extends ReactiveCrudRepository<SubscriptionEntity, Long> {

    Mono<SubscriptionEntity> findByScopeAndTargetId(String scope, String targetId);
}
