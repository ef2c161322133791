package com.vcc.router.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.router.config.RouterProperties;
import com.vcc.router.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Optional;

/**
 * Guards the policy, subscription and registry admin API. Routing traffic on {@code /v1} is never
 * inspected. Authenticated requests carry the masked key as the audit actor.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class AdminSecurityFilter implements WebFilter {
    private static final Logger log = LoggerFactory.getLogger(AdminSecurityFilter.class);

    static final String ADMIN_PATH_PREFIX = "/admin";
    static final String ADMIN_ACTOR_ATTR = "adminActor";
    static final String UNAUTHORIZED = "unauthorized";
    static final String ADMIN_DISABLED = "admin_disabled";

    private final ObjectMapper objectMapper;
    private final String keyHeader;
    private final List<byte[]> acceptedKeys;

    public AdminSecurityFilter(RouterProperties properties, ObjectMapper objectMapper) {
        RouterProperties.AdminConfig admin = properties.getAdmin();
        this.objectMapper = objectMapper;
        this.keyHeader = admin.getApiKeyHeader();
        List<String> configured = admin.getAdminApiKeys() != null ? admin.getAdminApiKeys() : List.of();
        this.acceptedKeys = configured.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.getBytes(StandardCharsets.UTF_8))
                .toList();
        if (acceptedKeys.isEmpty()) {
            log.warn("No admin API keys configured, /admin endpoints answer 503");
        } else {
            log.info("Admin API enabled with {} key(s) on header {}", acceptedKeys.size(), keyHeader);
        }
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (!path.startsWith(ADMIN_PATH_PREFIX)) {
            return chain.filter(exchange);
        }
        if (acceptedKeys.isEmpty()) {
            return reject(exchange, HttpStatus.SERVICE_UNAVAILABLE, ADMIN_DISABLED, "Admin API is disabled");
        }

        String presented = exchange.getRequest().getHeaders().getFirst(keyHeader);
        Optional<String> actor = authenticate(presented);
        if (actor.isEmpty()) {
            log.warn("Rejected admin request {} {} from {}", exchange.getRequest().getMethod(), path,
                    exchange.getRequest().getRemoteAddress());
            String message = presented == null || presented.isBlank()
                    ? "Missing " + keyHeader + " header"
                    : "Admin API key not recognised";
            return reject(exchange, HttpStatus.UNAUTHORIZED, UNAUTHORIZED, message);
        }

        exchange.getAttributes().put(ADMIN_ACTOR_ATTR, actor.get());
        log.debug("Admin request {} {} by {}", exchange.getRequest().getMethod(), path, actor.get());
        return chain.filter(exchange);
    }

    /**
     * Audit actor for an accepted key. Keys are compared in constant time.
     */
    Optional<String> authenticate(String presented) {
        if (presented == null || presented.isBlank()) {
            return Optional.empty();
        }
        byte[] candidate = presented.getBytes(StandardCharsets.UTF_8);
        boolean accepted = false;
        for (byte[] key : acceptedKeys) {
            accepted |= MessageDigest.isEqual(key, candidate);
        }
        return accepted ? Optional.of("admin:" + maskKey(presented)) : Optional.empty();
    }

    private Mono<Void> reject(ServerWebExchange exchange, HttpStatus status, String reason, String message) {
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        return Mono.fromCallable(() -> objectMapper.writeValueAsBytes(ErrorResponse.of(null, reason, message)))
                .flatMap(bytes -> response.writeWith(Mono.just(response.bufferFactory().wrap(bytes))));
    }

    static String maskKey(String key) {
        if (key == null || key.length() < 8) {
            return "****";
        }
        return key.substring(0, 8) + "...";
    }
}
