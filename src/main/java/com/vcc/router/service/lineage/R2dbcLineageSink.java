package com.vcc.router.service.lineage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.router.entity.DecisionTraceEntity;
import com.vcc.router.model.DecisionTrace;
import com.vcc.router.repository.DecisionTraceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Writes decision traces to the decision_trace table. Nested structures go to JSON columns.
 */
@Service
public class R2dbcLineageSink implements LineageSink {
    private static final Logger log = LoggerFactory.getLogger(R2dbcLineageSink.class);

    private final DecisionTraceRepository repository;
    private final ObjectMapper objectMapper;

    public R2dbcLineageSink(DecisionTraceRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> write(DecisionTrace trace) {
        return Mono.fromCallable(() -> toEntity(trace))
                .flatMap(repository::save)
                .doOnSuccess(saved -> log.debug("Persisted decision trace auditId={} id={}",
                        saved.getAuditId(), saved.getId()))
                .then();
    }

    DecisionTraceEntity toEntity(DecisionTrace trace) {
        DecisionTraceEntity entity = new DecisionTraceEntity();
        entity.setAuditId(trace.getAuditId());
        entity.setTenantId(trace.getContext().tenantId());
        entity.setAppId(trace.getContext().appId());
        entity.setTeamId(trace.getContext().teamId());
        entity.setPolicyVersion(trace.getPolicyVersion());
        entity.setRuleId(trace.getRuleId());
        entity.setSubscriptionScope(trace.getSubscriptionScope() != null ? trace.getSubscriptionScope().name() : null);
        entity.setRecommendedModel(trace.getRecommendedModel());
        entity.setFinalModel(trace.getFinalModel());
        entity.setFallbackChain(String.join(",", trace.getFallbackChain()));
        entity.setAttemptsJson(toJson(trace.getAttempts()));
        entity.setFellBack(trace.isFellBack());
        entity.setDowngraded(trace.isDowngraded());
        entity.setExperimentId(trace.getExperimentId());
        entity.setExperimentArm(trace.getExperimentArm());
        entity.setFirewallState(trace.getFirewallState() != null ? trace.getFirewallState().name() : null);
        entity.setViolationsJson(toJson(trace.getViolations()));
        entity.setSanitizingModel(trace.getSanitizingModel());
        entity.setFirewallDegraded(trace.isFirewallDegraded());
        entity.setPromptTokens(trace.getUsage().promptTokens());
        entity.setCompletionTokens(trace.getUsage().completionTokens());
        entity.setCost(trace.getCost());
        entity.setFirewallCost(trace.getFirewallCost());
        entity.setStageTimingsJson(toJson(trace.getStageMicros()));
        entity.setStatus(trace.getStatus().name());
        entity.setReasonCode(trace.getReasonCode());
        entity.setStartedAt(trace.getStartedAt());
        entity.setCompletedAt(trace.getCompletedAt());
        return entity;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize trace detail: {}", e.getMessage());
            return "null";
        }
    }
}
