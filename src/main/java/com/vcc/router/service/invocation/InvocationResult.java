package com.vcc.router.service.invocation;

import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.ProviderResponse;

/**
 * Outcome of a successful invocation.
 *
 * @param fellBack           the serving model differs from the recommended one
 * @param degradedCompletion served by the minimal-completion attempt after the chain was exhausted
 */
public record InvocationResult(
        ModelDescriptor model,
        ProviderResponse response,
        boolean fellBack,
        boolean degradedCompletion
) {
}
