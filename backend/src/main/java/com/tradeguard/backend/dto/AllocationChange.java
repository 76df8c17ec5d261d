package com.tradeguard.backend.dto;

public record AllocationChange(String id, String strategyRef, double allocation, String reason) {}
