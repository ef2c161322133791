package com.vcc.router.service.firewall;

import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.ProviderResponse;
import reactor.core.publisher.Mono;

/**
 * Rewrites an output so that it no longer contains sensitive content.
 */
public interface SanitizingAdapter {

    Mono<ProviderResponse> sanitize(ModelDescriptor model, String output);
}
