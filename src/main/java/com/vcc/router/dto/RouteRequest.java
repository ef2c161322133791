package com.vcc.router.dto;

import com.vcc.router.model.FirewallAction;
import com.vcc.router.model.RequestContext;
import com.vcc.router.model.RequestOptions;
import com.vcc.router.model.Sensitivity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Set;

/**
 * Request DTO for routing one inference request.
 */
public record RouteRequest(
        @NotBlank(message = "App ID is required")
        @Size(max = 64, message = "App ID must be at most 64 characters")
        String appId,

        @NotBlank(message = "Tenant ID is required")
        @Size(max = 64, message = "Tenant ID must be at most 64 characters")
        String tenantId,

        @Size(max = 64, message = "Team ID must be at most 64 characters")
        String teamId,

        String userRole,

        @NotNull(message = "Input is required")
        String input,

        Sensitivity sensitivity,

        String language,

        Set<String> tags,

        @Size(max = 256, message = "Request key must be at most 256 characters")
        String requestKey,

        @Min(value = 0, message = "Token estimate cannot be negative")
        Integer tokenEstimate,

        @Valid
        Options options
) {

    public record Options(
            @Min(value = 1, message = "Max tokens must be at least 1")
            Integer maxTokens,

            @DecimalMin(value = "0.0", message = "Temperature cannot be negative")
            @DecimalMax(value = "2.0", message = "Temperature must be at most 2.0")
            Double temperature,

            FirewallAction firewallAction
    ) {
    }

    public RequestContext toContext() {
        RequestOptions requestOptions = options != null
                ? new RequestOptions(options.maxTokens(), options.temperature(), options.firewallAction())
                : RequestOptions.none();
        int tokens = tokenEstimate != null ? tokenEstimate : RequestContext.estimateTokens(input);
        return new RequestContext(tenantId, appId, teamId, userRole, sensitivity, tokens, language, tags,
                requestKey, requestOptions);
    }
}
