package com.vcc.router.dto;

/**
 * Response DTO for a published policy version.
 */
public record PublishPolicyResponse(
        String appId,
        long version,
        int ruleCount,
        String status
) {
}
