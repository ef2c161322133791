package com.vcc.router.repository;

import com.vcc.router.entity.PolicyVersionEntity;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface PolicyVersionRepository extends ReactiveCrudRepository<PolicyVersionEntity, Long> {

    // Latest version per app
    @Query("SELECT p.* FROM policy_version p "
            + "JOIN (SELECT app_id, MAX(version) AS version FROM policy_version GROUP BY app_id) latest "
            + "ON p.app_id = latest.app_id AND p.version = latest.version")
    Flux<PolicyVersionEntity> findLatestVersions();

    Mono<PolicyVersionEntity> findByAppIdAndVersion(String appId, long version);
}
