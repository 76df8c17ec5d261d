package com.tradeguard.backend.service;

import com.tradeguard.backend.config.AllocatorProperties;
import com.tradeguard.backend.config.AuditProperties;
import com.tradeguard.backend.config.GateProperties;
import com.tradeguard.backend.config.ProverProperties;
import com.tradeguard.backend.dto.AuditStamp;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;

/**
 * Builds provenance stamps. The policy hash fingerprints the active gate,
 * prover and allocator settings so an audit record can be tied to the rules
 * that were in force when it was written.
 */
@Component
public class AuditStampFactory {

    private final AuditProperties auditProperties;
    private final GateProperties gateProperties;
    private final ProverProperties proverProperties;
    private final AllocatorProperties allocatorProperties;
    private final Clock clock;

    public AuditStampFactory(AuditProperties auditProperties, GateProperties gateProperties,
                             ProverProperties proverProperties, AllocatorProperties allocatorProperties, Clock clock) {
        this.auditProperties = auditProperties;
        this.gateProperties = gateProperties;
        this.proverProperties = proverProperties;
        this.allocatorProperties = allocatorProperties;
        this.clock = clock;
    }

    public AuditStamp stamp() {
        return new AuditStamp(
                clock.instant(),
                auditProperties.getCommitHash(),
                policyHash(),
                auditProperties.getEnvironment(),
                auditProperties.isWormMode()
        );
    }

    public String policyHash() {
        String policy = gateProperties + "|" + proverProperties + "|" + allocatorProperties;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(policy.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
