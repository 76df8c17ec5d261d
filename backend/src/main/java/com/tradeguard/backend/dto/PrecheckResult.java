package com.tradeguard.backend.dto;

import java.util.List;

public record PrecheckResult(boolean passed, List<String> failures) {}
