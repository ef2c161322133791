package com.vcc.router.service.firewall;

import com.vcc.router.model.InvocationOptions;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.ProviderResponse;
import com.vcc.router.service.invocation.ProviderAdapter;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Sanitizes through an ordinary model call with a fixed rewrite instruction.
 */
@Component
public class ProviderSanitizingAdapter implements SanitizingAdapter {

    static final String REWRITE_INSTRUCTION = "Rewrite the following text so that it keeps its meaning but "
            + "contains no payment card numbers, government identifiers, e-mail addresses, credentials or "
            + "other personal data. Replace removed values with [REDACTED]. Return only the rewritten text.";

    private final ProviderAdapter providerAdapter;

    public ProviderSanitizingAdapter(ProviderAdapter providerAdapter) {
        this.providerAdapter = providerAdapter;
    }

    @Override
    public Mono<ProviderResponse> sanitize(ModelDescriptor model, String output) {
        return providerAdapter.invoke(model, output, InvocationOptions.withInstruction(REWRITE_INSTRUCTION));
    }
}
