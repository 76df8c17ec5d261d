package com.tradeguard.backend.dto;

import java.time.Instant;
import java.util.List;

public record FreezeResult(List<String> frozenIds, String reason, Instant frozenAt) {}
