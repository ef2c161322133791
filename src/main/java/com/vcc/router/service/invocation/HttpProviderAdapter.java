package com.vcc.router.service.invocation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.vcc.router.config.RouterProperties;
import com.vcc.router.exception.ProviderException;
import com.vcc.router.model.InvocationOptions;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.ProviderErrorClass;
import com.vcc.router.model.ProviderResponse;
import com.vcc.router.model.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provider adapter speaking the router's JSON invoke protocol over HTTP.
 * POSTs to {@code {baseUrl}/v1/invoke} with the provider key in {@code x-api-key}.
 */
@Service
public class HttpProviderAdapter implements ProviderAdapter {
    private static final Logger log = LoggerFactory.getLogger(HttpProviderAdapter.class);

    private final Map<String, RouterProperties.ProviderConfig> providers = new ConcurrentHashMap<>();
    private final Map<String, WebClient> clients = new ConcurrentHashMap<>();
    private final WebClient.Builder builder;

    public HttpProviderAdapter(WebClient.Builder builder, RouterProperties properties) {
        this.builder = builder;
        for (RouterProperties.ProviderConfig provider : properties.getProviders()) {
            providers.put(provider.getId(), provider);
        }
        log.info("HttpProviderAdapter initialized with providers={}", providers.keySet());
    }

    @Override
    public Mono<ProviderResponse> invoke(ModelDescriptor model, String input, InvocationOptions options) {
        RouterProperties.ProviderConfig provider = providers.get(model.provider());
        if (provider == null || !provider.isEnabled()) {
            return Mono.error(new ProviderException(ProviderErrorClass.SERVER_ERROR,
                    "provider '" + model.provider() + "' is not configured or disabled"));
        }
        WebClient client = clients.computeIfAbsent(provider.getId(),
                id -> builder.clone().baseUrl(provider.getBaseUrl()).build());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model.name());
        body.put("version", model.version());
        body.put("input", input);
        body.put("maxTokens", options.maxTokens());
        body.put("temperature", options.temperature());
        body.put("instruction", options.instruction());

        long started = System.nanoTime();
        return client.post()
                .uri("/v1/invoke")
                .header("x-api-key", provider.getApiKey() != null ? provider.getApiKey() : "")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchangeToMono(response -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.bodyToMono(InvokeReply.class)
                                .switchIfEmpty(Mono.error(new ProviderException(ProviderErrorClass.SERVER_ERROR,
                                        "empty response body from " + model.id())))
                                .map(reply -> new ProviderResponse(
                                        reply.output(),
                                        reply.usage() != null ? reply.usage() : TokenUsage.none(),
                                        Duration.ofNanos(System.nanoTime() - started)));
                    }
                    return response.releaseBody().then(Mono.error(toProviderException(model, response)));
                })
                .onErrorMap(WebClientRequestException.class, e -> new ProviderException(
                        ProviderErrorClass.SERVER_ERROR, "connection to " + model.provider() + " failed: "
                        + e.getMessage(), null, e))
                .doOnError(e -> log.debug("Provider call failed: model={}, provider={}, error={}",
                        model.id(), model.provider(), e.getMessage()));
    }

    static ProviderException toProviderException(ModelDescriptor model, ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        String message = "provider " + model.provider() + " returned " + status.value() + " for " + model.id();
        ProviderErrorClass errorClass = classify(status);
        Duration retryAfter = errorClass == ProviderErrorClass.RATE_LIMITED
                ? parseRetryAfter(response.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER))
                : null;
        return new ProviderException(errorClass, message, retryAfter, null);
    }

    static ProviderErrorClass classify(HttpStatusCode status) {
        int code = status.value();
        if (code == 429) {
            return ProviderErrorClass.RATE_LIMITED;
        }
        if (code == 408 || code == 504) {
            return ProviderErrorClass.TIMEOUT;
        }
        if (code == 401 || code == 403) {
            return ProviderErrorClass.AUTH_FAILURE;
        }
        if (status.is5xxServerError()) {
            return ProviderErrorClass.SERVER_ERROR;
        }
        return ProviderErrorClass.MALFORMED_REQUEST;
    }

    /**
     * Retry-After in delta-seconds form; HTTP-date values are ignored.
     */
    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After: {}", header);
            return null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InvokeReply(String output, TokenUsage usage) {
    }
}
