package com.vcc.router.model;

/**
 * Options forwarded to a provider adapter. {@code instruction} carries a fixed system
 * instruction for sanitizing and judging calls and is null for ordinary inference.
 */
public record InvocationOptions(
        Integer maxTokens,
        Double temperature,
        String instruction
) {

    public static InvocationOptions from(RequestOptions options) {
        return new InvocationOptions(options.maxTokens(), options.temperature(), null);
    }

    public static InvocationOptions withInstruction(String instruction) {
        return new InvocationOptions(null, 0.0d, instruction);
    }
}
