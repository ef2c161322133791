package com.vcc.router.service.invocation;

import com.vcc.router.exception.ProviderException;
import com.vcc.router.model.ProviderErrorClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.ClientResponse;

import java.time.Duration;

import static com.vcc.router.support.Fixtures.external;
import static org.assertj.core.api.Assertions.assertThat;

class HttpProviderAdapterTest {

    @Test
    @DisplayName("status codes map onto provider error classes")
    void classify() {
        assertThat(HttpProviderAdapter.classify(HttpStatus.TOO_MANY_REQUESTS)).isEqualTo(ProviderErrorClass.RATE_LIMITED);
        assertThat(HttpProviderAdapter.classify(HttpStatus.REQUEST_TIMEOUT)).isEqualTo(ProviderErrorClass.TIMEOUT);
        assertThat(HttpProviderAdapter.classify(HttpStatus.GATEWAY_TIMEOUT)).isEqualTo(ProviderErrorClass.TIMEOUT);
        assertThat(HttpProviderAdapter.classify(HttpStatus.UNAUTHORIZED)).isEqualTo(ProviderErrorClass.AUTH_FAILURE);
        assertThat(HttpProviderAdapter.classify(HttpStatus.FORBIDDEN)).isEqualTo(ProviderErrorClass.AUTH_FAILURE);
        assertThat(HttpProviderAdapter.classify(HttpStatus.BAD_GATEWAY)).isEqualTo(ProviderErrorClass.SERVER_ERROR);
        assertThat(HttpProviderAdapter.classify(HttpStatusCode.valueOf(529))).isEqualTo(ProviderErrorClass.SERVER_ERROR);
        assertThat(HttpProviderAdapter.classify(HttpStatus.BAD_REQUEST)).isEqualTo(ProviderErrorClass.MALFORMED_REQUEST);
        assertThat(HttpProviderAdapter.classify(HttpStatus.PAYLOAD_TOO_LARGE))
                .isEqualTo(ProviderErrorClass.MALFORMED_REQUEST);
    }

    @Test
    @DisplayName("Retry-After accepts delta-seconds only")
    void parseRetryAfter() {
        assertThat(HttpProviderAdapter.parseRetryAfter("3")).isEqualTo(Duration.ofSeconds(3));
        assertThat(HttpProviderAdapter.parseRetryAfter(" 0 ")).isEqualTo(Duration.ZERO);
        assertThat(HttpProviderAdapter.parseRetryAfter("Wed, 21 Oct 2026 07:28:00 GMT")).isNull();
        assertThat(HttpProviderAdapter.parseRetryAfter("-1")).isNull();
        assertThat(HttpProviderAdapter.parseRetryAfter("")).isNull();
        assertThat(HttpProviderAdapter.parseRetryAfter(null)).isNull();
    }

    @Test
    @DisplayName("rate-limited responses carry their Retry-After")
    void rateLimitedResponse() {
        ClientResponse response = ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS)
                .header("Retry-After", "2")
                .build();

        ProviderException e = HttpProviderAdapter.toProviderException(
                external("claude-sonnet", "anthropic", "0.003", "0.015"), response);

        assertThat(e.getErrorClass()).isEqualTo(ProviderErrorClass.RATE_LIMITED);
        assertThat(e.getRetryAfter()).isEqualTo(Duration.ofSeconds(2));
        assertThat(e.getMessage()).contains("429").contains("claude-sonnet");
    }

    @Test
    @DisplayName("Retry-After is ignored outside rate limiting")
    void serverErrorIgnoresRetryAfter() {
        ClientResponse response = ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE)
                .header("Retry-After", "2")
                .build();

        ProviderException e = HttpProviderAdapter.toProviderException(
                external("gpt-large", "openai", "0.005", "0.015"), response);

        assertThat(e.getErrorClass()).isEqualTo(ProviderErrorClass.SERVER_ERROR);
        assertThat(e.getRetryAfter()).isNull();
    }
}
