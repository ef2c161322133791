package com.vcc.router.model;

public record TokenUsage(
        int promptTokens,
        int completionTokens
) {

    public static TokenUsage none() {
        return new TokenUsage(0, 0);
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}
