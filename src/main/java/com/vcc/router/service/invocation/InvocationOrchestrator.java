package com.vcc.router.service.invocation;

import com.vcc.router.config.RouterProperties;
import com.vcc.router.exception.ExhaustedFallbackException;
import com.vcc.router.exception.ProviderException;
import com.vcc.router.model.Candidate;
import com.vcc.router.model.InvocationAttempt;
import com.vcc.router.model.InvocationOptions;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.ProviderErrorClass;
import com.vcc.router.model.ProviderResponse;
import com.vcc.router.service.health.CircuitState;
import com.vcc.router.service.health.HealthTracker;
import com.vcc.router.service.metrics.MetricsSink;
import com.vcc.router.service.pipeline.RoutingContext;
import com.vcc.router.service.selection.Selection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Walks the recommended model and its fallback chain one candidate at a time. Retryable failures
 * are retried on the same model with jittered exponential backoff; anything else, or running out
 * of attempts, moves on to the next candidate. Every attempt is recorded on the trace in order.
 */
@Service
public class InvocationOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(InvocationOrchestrator.class);

    private final ProviderAdapter adapter;
    private final HealthTracker healthTracker;
    private final MetricsSink metrics;
    private final int maxAttempts;
    private final Duration baseBackoff;
    private final Duration maxBackoff;
    private final double jitter;
    private final Duration providerTimeout;
    private final boolean minimalCompletionDefault;

    public InvocationOrchestrator(ProviderAdapter adapter,
                                  HealthTracker healthTracker,
                                  MetricsSink metrics,
                                  RouterProperties properties) {
        this.adapter = adapter;
        this.healthTracker = healthTracker;
        this.metrics = metrics;
        RouterProperties.RetryConfig retry = properties.getRetry();
        this.maxAttempts = Math.max(1, retry.getMaxAttempts());
        this.baseBackoff = retry.getBaseBackoff();
        this.maxBackoff = retry.getMaxBackoff();
        this.jitter = retry.getJitter();
        this.providerTimeout = properties.getTimeouts().getProvider();
        this.minimalCompletionDefault = properties.getDegrade().isMinimalCompletion();
        log.info("InvocationOrchestrator initialized: maxAttempts={}, baseBackoff={}, maxBackoff={}, timeout={}",
                maxAttempts, baseBackoff, maxBackoff, providerTimeout);
    }

    public Mono<InvocationResult> invoke(Selection selection, String input, RoutingContext context) {
        InvocationOptions options = InvocationOptions.from(context.request().options());
        AtomicReference<ProviderException> lastFailure = new AtomicReference<>();
        return walk(selection.plan(), 0, selection.recommended(), input, options, context, lastFailure);
    }

    private Mono<InvocationResult> walk(List<Candidate> plan, int index, Candidate recommended, String input,
                                        InvocationOptions options, RoutingContext context,
                                        AtomicReference<ProviderException> lastFailure) {
        if (index >= plan.size()) {
            return exhausted(input, options, context, lastFailure.get());
        }
        Candidate candidate = plan.get(index);
        if (!admit(candidate.model(), context)) {
            return walk(plan, index + 1, recommended, input, options, context, lastFailure);
        }
        if (index > 0) {
            metrics.increment("fallback", context.request().appId(), candidate.modelId(),
                    candidate.model().provider(), lastFailure.get() != null ? reasonOf(lastFailure.get()) : "skipped");
        }
        return invokeWithRetry(candidate.model(), input, options, context)
                .map(response -> new InvocationResult(candidate.model(), response,
                        !candidate.modelId().equals(recommended.modelId()), false))
                .onErrorResume(ProviderException.class, e -> {
                    lastFailure.set(e);
                    log.info("auditId={} model={} failed with {}, advancing fallback chain",
                            context.auditId(), candidate.modelId(), e.getErrorClass());
                    return walk(plan, index + 1, recommended, input, options, context, lastFailure);
                });
    }

    /**
     * Whether the model may be attempted now. Open circuits are skipped; a half-open circuit is
     * only attempted by the request holding its probe.
     */
    private boolean admit(ModelDescriptor model, RoutingContext context) {
        CircuitState state = healthTracker.state(model.id());
        if (state == CircuitState.OPEN) {
            log.debug("auditId={} model={} skipped: circuit open", context.auditId(), model.id());
            return false;
        }
        if (state == CircuitState.HALF_OPEN && !context.holdsProbe(model.id())) {
            if (!healthTracker.tryAcquireProbe(model.id())) {
                metrics.increment("probe_bypassed", context.request().appId(), model.id(), model.provider(), null);
                return false;
            }
            context.holdProbe(model.id());
        }
        return true;
    }

    private Mono<ProviderResponse> invokeWithRetry(ModelDescriptor model, String input, InvocationOptions options,
                                                   RoutingContext context) {
        AtomicInteger attemptNo = new AtomicInteger();
        return Mono.defer(() -> attempt(model, attemptNo.incrementAndGet(), input, options, context))
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                    Throwable failure = signal.failure();
                    long retriesSoFar = signal.totalRetries();
                    Optional<Duration> delay = retryDelay(model, failure, retriesSoFar);
                    if (delay.isEmpty()) {
                        return Mono.error(failure);
                    }
                    metrics.increment("retry", context.request().appId(), model.id(), model.provider(),
                            reasonOf(failure));
                    log.debug("auditId={} model={} retry {} in {}ms", context.auditId(), model.id(),
                            retriesSoFar + 1, delay.get().toMillis());
                    return Mono.delay(delay.get()).thenReturn(retriesSoFar);
                })));
    }

    /**
     * Delay before the next attempt on the same model, or empty when the model should be abandoned.
     */
    Optional<Duration> retryDelay(ModelDescriptor model, Throwable failure, long retriesSoFar) {
        if (!ProviderException.isRetryable(failure) || retriesSoFar + 1 >= maxAttempts) {
            return Optional.empty();
        }
        // A probe failure re-opens the circuit; no further attempts on this model
        if (healthTracker.isOpen(model.id())) {
            return Optional.empty();
        }
        Duration retryAfter = ((ProviderException) failure).getRetryAfter();
        if (retryAfter != null && retryAfter.compareTo(maxBackoff) > 0) {
            return Optional.empty();
        }
        Duration backoff = backoff(retriesSoFar);
        return Optional.of(retryAfter != null && retryAfter.compareTo(backoff) > 0 ? retryAfter : backoff);
    }

    Duration backoff(long retriesSoFar) {
        long base = baseBackoff.toMillis();
        long exponential = base << Math.min(retriesSoFar, 20);
        long capped = Math.min(exponential, maxBackoff.toMillis());
        if (jitter <= 0.0d || capped == 0L) {
            return Duration.ofMillis(capped);
        }
        double spread = capped * jitter;
        double jittered = capped + ThreadLocalRandom.current().nextDouble(-spread, spread);
        return Duration.ofMillis(Math.max(0L, Math.min((long) jittered, maxBackoff.toMillis())));
    }

    private Mono<ProviderResponse> attempt(ModelDescriptor model, int attemptNo, String input,
                                           InvocationOptions options, RoutingContext context) {
        long started = System.nanoTime();
        String app = context.request().appId();
        return Mono.defer(() -> adapter.invoke(model, input, options))
                .switchIfEmpty(Mono.error(() -> new ProviderException(ProviderErrorClass.SERVER_ERROR,
                        model.id() + " returned no response")))
                .timeout(providerTimeout)
                .onErrorMap(TimeoutException.class, e -> new ProviderException(ProviderErrorClass.TIMEOUT,
                        model.id() + " did not answer within " + providerTimeout.toMillis() + "ms", null, e))
                .onErrorMap(e -> !(e instanceof ProviderException),
                        e -> new ProviderException(ProviderErrorClass.SERVER_ERROR, e.getMessage(), null, e))
                .doOnSuccess(response -> {
                    Duration latency = Duration.ofNanos(System.nanoTime() - started);
                    healthTracker.recordSuccess(model, latency, context.consumeProbe(model.id()));
                    context.trace().recordAttempt(new InvocationAttempt(model.id(), attemptNo, true, null,
                            latency.toMillis()));
                    metrics.recordLatency(app, model.id(), model.provider(), "success", latency);
                })
                .doOnError(ProviderException.class, e -> {
                    Duration latency = Duration.ofNanos(System.nanoTime() - started);
                    healthTracker.recordFailure(model, latency, e.getErrorClass(), context.consumeProbe(model.id()));
                    context.trace().recordAttempt(new InvocationAttempt(model.id(), attemptNo, false,
                            e.getErrorClass(), latency.toMillis()));
                    metrics.increment("attempt_failed", app, model.id(), model.provider(), reasonOf(e));
                    metrics.recordLatency(app, model.id(), model.provider(), "failure", latency);
                    log.debug("auditId={} model={} attempt={} failed: {} ({})", context.auditId(), model.id(),
                            attemptNo, e.getErrorClass(), e.getMessage());
                });
    }

    private Mono<InvocationResult> exhausted(String input, InvocationOptions options, RoutingContext context,
                                             ProviderException lastFailure) {
        String app = context.request().appId();
        if (context.policy().minimalCompletionOr(minimalCompletionDefault)) {
            Optional<ModelDescriptor> cheapest = cheapestUntried(context);
            if (cheapest.isPresent()) {
                ModelDescriptor model = cheapest.get();
                log.info("auditId={} fallback chain exhausted, minimal completion on model={}",
                        context.auditId(), model.id());
                metrics.increment("degraded_completion", app, model.id(), model.provider(), null);
                return attempt(model, 1, input, options, context)
                        .map(response -> new InvocationResult(model, response, true, true))
                        .onErrorMap(ProviderException.class, e -> exhaustedError(context, e));
            }
        }
        return Mono.error(exhaustedError(context, lastFailure));
    }

    private Optional<ModelDescriptor> cheapestUntried(RoutingContext context) {
        List<String> attempted = context.trace().getAttemptedModels();
        return context.complianceEligible().stream()
                .filter(ModelDescriptor::enabled)
                .filter(context::isAffordable)
                .filter(m -> !attempted.contains(m.id()))
                .sorted(Comparator.comparing(ModelDescriptor::unitPrice).thenComparing(ModelDescriptor::id))
                .filter(m -> admit(m, context))
                .findFirst();
    }

    private ExhaustedFallbackException exhaustedError(RoutingContext context, ProviderException lastFailure) {
        List<String> attempted = context.trace().getAttemptedModels();
        metrics.increment("exhausted", context.request().appId(), null, null,
                lastFailure != null ? reasonOf(lastFailure) : "all_circuits_open");
        return new ExhaustedFallbackException(context.auditId(), attempted, remediation(lastFailure), lastFailure);
    }

    static String remediation(ProviderException lastFailure) {
        if (lastFailure == null) {
            return "All candidate circuits are open; retry after the circuit cool-down or add fallback models to the policy.";
        }
        return switch (lastFailure.getErrorClass()) {
            case AUTH_FAILURE -> "Provider rejected the router's credentials; check the provider API key configuration.";
            case MALFORMED_REQUEST -> "Provider rejected the request as malformed; check input size and options.";
            case RATE_LIMITED -> "Providers are rate limiting; retry later or raise the provider quota.";
            case TIMEOUT, SERVER_ERROR -> "Providers are unavailable; retry later or add fallback models to the policy.";
        };
    }

    private static String reasonOf(Throwable failure) {
        if (failure instanceof ProviderException pe) {
            return pe.getErrorClass().name().toLowerCase(Locale.ROOT);
        }
        return "unknown";
    }
}
