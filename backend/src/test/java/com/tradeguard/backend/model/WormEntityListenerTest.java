package com.tradeguard.backend.model;

import com.tradeguard.backend.exception.WormViolationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WormEntityListenerTest {

    private final WormEntityListener listener = new WormEntityListener();

    @Test
    void rejectsUpdates() {
        assertThatThrownBy(() -> listener.rejectUpdate(QuoteSnapshot.builder().symbol("SPY").build()))
                .isInstanceOf(WormViolationException.class)
                .hasMessageContaining("update rejected for QuoteSnapshot");
    }

    @Test
    void rejectsDeletes() {
        assertThatThrownBy(() -> listener.rejectRemove(AuditTrailEntry.builder().build()))
                .isInstanceOf(WormViolationException.class)
                .hasMessageContaining("delete rejected for AuditTrailEntry");
    }
}
