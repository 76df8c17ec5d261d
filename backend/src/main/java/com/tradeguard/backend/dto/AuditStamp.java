package com.tradeguard.backend.dto;

import java.time.Instant;

public record AuditStamp(
        Instant serverTs,
        String commitHash,
        String policyHash,
        String environment,
        boolean wormMode
) {}
