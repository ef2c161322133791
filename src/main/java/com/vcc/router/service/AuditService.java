package com.vcc.router.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.router.config.RouterProperties;
import com.vcc.router.entity.AdminAuditLogEntity;
import com.vcc.router.model.Policy;
import com.vcc.router.model.Subscription;
import com.vcc.router.repository.AdminAuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;

/**
 * Audit logging service for admin operations.
 * Records every admin mutation with actor, target, and details. Rows are written only when
 * the database store is enabled; the log line is always emitted.
 */
@Service
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AdminAuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final RouterProperties properties;
    private final Clock clock;

    // Standard action types
    public static final String ACTION_PUBLISH_POLICY = "PUBLISH_POLICY";
    public static final String ACTION_UPSERT_SUBSCRIPTION = "UPSERT_SUBSCRIPTION";
    public static final String ACTION_REFRESH_REGISTRY = "REFRESH_REGISTRY";

    // Target types
    public static final String TARGET_POLICY = "policy";
    public static final String TARGET_SUBSCRIPTION = "subscription";
    public static final String TARGET_MODEL_REGISTRY = "model_registry";

    public AuditService(AdminAuditLogRepository auditLogRepository,
                        ObjectMapper objectMapper,
                        RouterProperties properties,
                        Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Log an admin action.
     *
     * @param actor      The admin user performing the action
     * @param action     The action type (e.g., PUBLISH_POLICY)
     * @param targetType The type of target (e.g., policy, subscription)
     * @param targetId   The ID of the target
     * @param details    Additional details as key-value pairs
     * @param clientIp   Client IP address
     * @return The audit log entry, saved when the database store is enabled
     */
    public Mono<AdminAuditLogEntity> logAction(
            String actor,
            String action,
            String targetType,
            String targetId,
            Map<String, Object> details,
            String clientIp
    ) {
        AdminAuditLogEntity entity = new AdminAuditLogEntity();
        entity.setActor(actor != null ? actor : "unknown");
        entity.setAction(action);
        entity.setTargetType(targetType);
        entity.setTargetId(targetId);
        entity.setClientIp(clientIp);
        entity.setCreatedAt(clock.instant());

        if (details != null && !details.isEmpty()) {
            try {
                entity.setDetailJson(objectMapper.writeValueAsString(details));
            } catch (JsonProcessingException e) {
                log.warn("Failed to serialize audit details: {}", e.getMessage());
                entity.setDetailJson("{}");
            }
        }

        if (!properties.getStore().isUseDatabase()) {
            log.info("Audit: {} {} {} by {} from {} detail={}",
                    action, targetType, targetId, entity.getActor(), clientIp, entity.getDetailJson());
            return Mono.just(entity);
        }

        return auditLogRepository.save(entity)
                .doOnSuccess(saved -> log.info("Audit: {} {} {} by {} from {}",
                        action, targetType, targetId, actor, clientIp))
                .doOnError(e -> log.error("Failed to save audit log: {}", e.getMessage()));
    }

    /**
     * Log a policy publication.
     */
    public Mono<AdminAuditLogEntity> logPolicyPublished(String actor, Policy policy, String clientIp) {
        return logAction(
                actor,
                ACTION_PUBLISH_POLICY,
                TARGET_POLICY,
                policy.appId(),
                Map.of(
                        "version", policy.version(),
                        "ruleCount", policy.rules().size()
                ),
                clientIp
        );
    }

    /**
     * Log a subscription create or replace.
     */
    public Mono<AdminAuditLogEntity> logSubscriptionUpserted(String actor, Subscription subscription,
                                                             String clientIp) {
        return logAction(
                actor,
                ACTION_UPSERT_SUBSCRIPTION,
                TARGET_SUBSCRIPTION,
                subscription.scope().name().toLowerCase(Locale.ROOT) + ":" + subscription.targetId(),
                Map.of(
                        "models", subscription.models(),
                        "enabled", subscription.enabled()
                ),
                clientIp
        );
    }

    /**
     * Log a model registry reload.
     */
    public Mono<AdminAuditLogEntity> logRegistryRefreshed(String actor, int modelCount, String clientIp) {
        return logAction(
                actor,
                ACTION_REFRESH_REGISTRY,
                TARGET_MODEL_REGISTRY,
                null,
                Map.of("modelCount", modelCount),
                clientIp
        );
    }

    // ==================== Query Methods ====================

    /**
     * Get recent audit logs. Empty unless the database store is enabled.
     */
    public Flux<AdminAuditLogEntity> getRecentLogs(int limit) {
        if (!properties.getStore().isUseDatabase()) {
            return Flux.empty();
        }
        return auditLogRepository.findRecent(Math.min(limit, 1000));
    }

    /**
     * Get audit logs for a specific target.
     */
    public Flux<AdminAuditLogEntity> getLogsForTarget(String targetType, String targetId) {
        if (!properties.getStore().isUseDatabase()) {
            return Flux.empty();
        }
        return auditLogRepository.findByTargetTypeAndTargetId(targetType, targetId);
    }
}
