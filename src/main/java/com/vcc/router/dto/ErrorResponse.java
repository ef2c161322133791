package com.vcc.router.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Error body returned for every refused or failed request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String auditId,
        String reason,
        String message,
        List<String> attemptedChain,
        String remediation,
        List<String> violations
) {

    public static ErrorResponse of(String auditId, String reason, String message) {
        return new ErrorResponse(auditId, reason, message, null, null, null);
    }
}
