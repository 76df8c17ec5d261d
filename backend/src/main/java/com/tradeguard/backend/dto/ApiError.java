package com.tradeguard.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Error body for every failed request. {@code failClosedReason} is set when a
 * safety precondition refused the operation; {@code retryable} tells the caller
 * whether the same request may succeed later without changes.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        Instant timestamp,
        String path,
        int status,
        String errorCode,
        String message,
        String failClosedReason,
        boolean retryable,
        String requestId,
        String correlationId,
        List<ApiErrorDetail> details
) {}
