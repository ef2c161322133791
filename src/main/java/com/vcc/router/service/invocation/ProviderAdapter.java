package com.vcc.router.service.invocation;

import com.vcc.router.model.InvocationOptions;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.ProviderResponse;
import reactor.core.publisher.Mono;

/**
 * Calls one model. Failures are signalled as {@link com.vcc.router.exception.ProviderException}
 * carrying the error class; callers bound the call with their own timeout.
 */
public interface ProviderAdapter {

    Mono<ProviderResponse> invoke(ModelDescriptor model, String input, InvocationOptions options);
}
