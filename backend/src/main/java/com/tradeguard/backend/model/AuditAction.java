package com.tradeguard.backend.model;

/**
 * Operator-visible events outside the market record: allocator state changes,
 * refused or unproven executions, and failed background tasks.
 */
public enum AuditAction {
    ALLOCATION_STAGED(Category.ALLOCATOR),
    ALLOCATION_STAGE_REPLAYED(Category.ALLOCATOR),
    REBALANCE_APPLIED(Category.ALLOCATOR),
    REBALANCE_REPLAYED(Category.ALLOCATOR),
    EMERGENCY_FREEZE(Category.ALLOCATOR),
    ORDER_GATE_REJECTED(Category.EXECUTION),
    PROOF_FAILED(Category.EXECUTION),
    TASK_FAILED(Category.SCHEDULER);

    private final Category category;

    AuditAction(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    public enum Category {
        ALLOCATOR,
        EXECUTION,
        SCHEDULER
    }
}
