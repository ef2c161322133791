package com.vcc.router.web;

import com.vcc.router.engine.RoutingEngine;
import com.vcc.router.engine.RoutingOutcome;
import com.vcc.router.exception.DenyReason;
import com.vcc.router.exception.ExhaustedFallbackException;
import com.vcc.router.exception.InternalRoutingException;
import com.vcc.router.exception.PolicyDenyException;
import com.vcc.router.model.FirewallOutcome;
import com.vcc.router.model.RequestContext;
import com.vcc.router.model.Sensitivity;
import com.vcc.router.model.TokenUsage;
import com.vcc.router.model.Violation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RoutingControllerTest {

    private static final String AUDIT_ID = "5f1c7a3e-0000-4000-8000-000000000042";

    private RoutingEngine engine;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        engine = mock(RoutingEngine.class);
        client = WebTestClient.bindToController(new RoutingController(engine))
                .controllerAdvice(new RoutingExceptionHandler())
                .build();
    }

    private WebTestClient.ResponseSpec post(String body) {
        return client.post().uri("/v1/route")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    @Test
    @DisplayName("served request returns models, usage and firewall result")
    void served() {
        FirewallOutcome firewall = FirewallOutcome.redrafted("safe text",
                List.of(new Violation("credit_card", "************1111")), "llama-local-small");
        when(engine.route(any(RequestContext.class), eq("hello"))).thenReturn(Mono.just(new RoutingOutcome(
                AUDIT_ID, "safe text", "claude-sonnet", "llama-local", true, false, "default", 3L,
                new TokenUsage(10, 20), new BigDecimal("0.000006"), firewall)));

        post("""
                {"appId":"support-assistant","tenantId":"acme","input":"hello",
                 "sensitivity":"high","tags":["billing"],"options":{"firewallAction":"redraft"}}
                """)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.auditId").isEqualTo(AUDIT_ID)
                .jsonPath("$.output").isEqualTo("safe text")
                .jsonPath("$.recommendedModel").isEqualTo("claude-sonnet")
                .jsonPath("$.finalModel").isEqualTo("llama-local")
                .jsonPath("$.fellBack").isEqualTo(true)
                .jsonPath("$.policyVersion").isEqualTo(3)
                .jsonPath("$.firewall.redrafted").isEqualTo(true)
                .jsonPath("$.firewall.sanitizingModel").isEqualTo("llama-local-small")
                .jsonPath("$.firewall.violations[0].sample").isEqualTo("************1111");

        ArgumentCaptor<RequestContext> captor = ArgumentCaptor.forClass(RequestContext.class);
        verify(engine).route(captor.capture(), eq("hello"));
        RequestContext context = captor.getValue();
        assertThat(context.sensitivity()).isEqualTo(Sensitivity.HIGH);
        assertThat(context.tags()).containsExactly("billing");
        assertThat(context.tokenEstimate()).isEqualTo(2);
        assertThat(context.options().firewallAction()).isNotNull();
    }

    @Test
    @DisplayName("missing required fields are rejected before routing")
    void invalidRequest() {
        post("{\"tenantId\":\"acme\"}")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.reason").isEqualTo("invalid_request")
                .jsonPath("$.violations").isArray();

        verify(engine, never()).route(any(), anyString());
    }

    @Test
    @DisplayName("policy deny maps to 403 with the reason code")
    void deny() {
        when(engine.route(any(), anyString())).thenReturn(Mono.error(
                new PolicyDenyException(DenyReason.BUDGET_EXCEEDED, AUDIT_ID, "budget exhausted")));

        post("{\"appId\":\"support-assistant\",\"tenantId\":\"acme\",\"input\":\"hi\"}")
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.reason").isEqualTo("budget_exceeded")
                .jsonPath("$.auditId").isEqualTo(AUDIT_ID);
    }

    @Test
    @DisplayName("exhausted fallback maps to 503 with the attempted chain")
    void exhausted() {
        when(engine.route(any(), anyString())).thenReturn(Mono.error(new ExhaustedFallbackException(
                AUDIT_ID, List.of("claude-sonnet", "llama-local"), "retry later", null)));

        post("{\"appId\":\"support-assistant\",\"tenantId\":\"acme\",\"input\":\"hi\"}")
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.reason").isEqualTo("exhausted_fallback")
                .jsonPath("$.attemptedChain[1]").isEqualTo("llama-local")
                .jsonPath("$.remediation").isEqualTo("retry later");
    }

    @Test
    @DisplayName("internal failures hide their cause")
    void internal() {
        when(engine.route(any(), anyString())).thenReturn(Mono.error(
                new InternalRoutingException(AUDIT_ID, new IllegalStateException("secret detail"))));

        post("{\"appId\":\"support-assistant\",\"tenantId\":\"acme\",\"input\":\"hi\"}")
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.reason").isEqualTo("internal_error")
                .jsonPath("$.message").isEqualTo("Internal routing error");
    }
}
