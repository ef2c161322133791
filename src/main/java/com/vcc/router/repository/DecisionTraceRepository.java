package com.vcc.router.repository;

import com.vcc.router.entity.DecisionTraceEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface DecisionTraceRepository extends ReactiveCrudRepository<DecisionTraceEntity, Long> {

    Mono<DecisionTraceEntity> findByAuditId(String auditId);
}
