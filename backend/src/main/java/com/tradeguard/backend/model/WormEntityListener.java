package com.tradeguard.backend.model;

import com.tradeguard.backend.exception.WormViolationException;
import jakarta.persistence.PreRemove;
import jakarta.persistence.PreUpdate;

/**
 * Rejects any attempt to modify or delete an audit record once it is stored.
 */
public class WormEntityListener {

    @PreUpdate
    void rejectUpdate(Object record) {
        throw new WormViolationException("Audit records are write-once: update rejected for " + describe(record));
    }

    @PreRemove
    void rejectRemove(Object record) {
        throw new WormViolationException("Audit records are write-once: delete rejected for " + describe(record));
    }

    private String describe(Object record) {
        return record == null ? "null" : record.getClass().getSimpleName();
    }
}
