package com.vcc.router.model;

/**
 * Caller-requested invocation options.
 */
public record RequestOptions(
        Integer maxTokens,
        Double temperature,
        FirewallAction firewallAction   // overrides the policy default when set
) {

    public static RequestOptions none() {
        return new RequestOptions(null, null, null);
    }
}
