package com.vcc.router.service.compliance;

import com.vcc.router.config.RouterProperties;
import com.vcc.router.exception.DenyReason;
import com.vcc.router.model.CandidateSet;
import com.vcc.router.model.CompliancePolicy;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.Policy;
import com.vcc.router.model.RequestContext;
import com.vcc.router.model.RoutingDirective;
import com.vcc.router.model.Sensitivity;
import com.vcc.router.service.pipeline.RoutingContext;
import com.vcc.router.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.vcc.router.support.Fixtures.external;
import static com.vcc.router.support.Fixtures.internal;
import static com.vcc.router.support.Fixtures.rule;
import static org.assertj.core.api.Assertions.assertThat;

class ComplianceFilterTest {

    private static final ModelDescriptor SONNET = external("claude-sonnet", "anthropic", "0.003", "0.015");
    private static final ModelDescriptor LLAMA = internal("llama-local", "onprem", "0.0002", "0.0002");

    private final RouterProperties properties = Fixtures.properties();
    private final ComplianceFilter filter = new ComplianceFilter(properties);

    private static Policy policyWith(CompliancePolicy compliance) {
        return Fixtures.policy(1, List.of(rule("r", List.of(), RoutingDirective.ordered("claude-sonnet"), null)),
                null, null, compliance, null);
    }

    @Test
    @DisplayName("sensitive requests never reach external models")
    void sensitiveRequestsStayInternal() {
        RoutingContext context = Fixtures.context(Fixtures.request(Sensitivity.HIGH, Set.of()),
                policyWith(null));

        CandidateSet kept = filter.apply(Fixtures.ordered(SONNET, LLAMA), context);

        assertThat(kept.modelIds()).containsExactly("llama-local");
        assertThat(context.complianceEligible()).extracting(ModelDescriptor::id).containsExactly("llama-local");
        assertThat(context.isComplianceEligible("claude-sonnet")).isFalse();
    }

    @Test
    @DisplayName("requests at the threshold may use external models")
    void atThreshold() {
        RoutingContext context = Fixtures.context(Fixtures.request(Sensitivity.MEDIUM, Set.of()), policyWith(null));

        assertThat(filter.apply(Fixtures.ordered(SONNET, LLAMA), context).modelIds())
                .containsExactly("claude-sonnet", "llama-local");
    }

    @Test
    @DisplayName("policy threshold overrides the service default")
    void policyThreshold() {
        Policy strict = policyWith(new CompliancePolicy(Sensitivity.LOW, null));
        RequestContext medium = Fixtures.request(Sensitivity.MEDIUM, Set.of());

        assertThat(filter.permits(SONNET, medium, strict)).isFalse();
        assertThat(filter.threshold(strict)).isEqualTo(Sensitivity.LOW);
        assertThat(filter.threshold(policyWith(null))).isEqualTo(Sensitivity.MEDIUM);
    }

    @Test
    @DisplayName("blocked tags exclude external models")
    void blockedTags() {
        Policy policy = policyWith(new CompliancePolicy(null, Set.of("pii")));

        assertThat(filter.permits(SONNET, Fixtures.request(Sensitivity.LOW, Set.of("pii", "billing")), policy))
                .isFalse();
        assertThat(filter.permits(SONNET, Fixtures.request(Sensitivity.LOW, Set.of("billing")), policy)).isTrue();
        assertThat(filter.permits(LLAMA, Fixtures.request(Sensitivity.CRITICAL, Set.of("pii")), policy)).isTrue();
    }

    @Test
    @DisplayName("emptying the set reports a compliance block")
    void denyReason() {
        RoutingContext context = Fixtures.context(Fixtures.request(Sensitivity.CRITICAL, Set.of()), policyWith(null));

        assertThat(filter.apply(Fixtures.ordered(SONNET), context).isEmpty()).isTrue();
        assertThat(filter.denyReason()).isEqualTo(DenyReason.COMPLIANCE_BLOCK);
    }
}
