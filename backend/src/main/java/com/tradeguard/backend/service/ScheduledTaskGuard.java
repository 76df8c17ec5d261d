package com.tradeguard.backend.service;

import com.tradeguard.backend.model.AuditAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Runs the sweeper, health probe and rebalance schedules. A failing run is
 * logged and audited but never cancels its schedule.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final AuditEventService auditEventService;
    private final Clock clock;

    /**
     * @return true when the task completed without throwing
     */
    public boolean run(String taskName, Runnable task) {
        String previousCorrelation = MDC.get("correlationId");
        MDC.put("correlationId", taskName + "-" + UUID.randomUUID());
        Instant started = clock.instant();
        try {
            task.run();
            log.debug("Task {} finished in {}ms", taskName, Duration.between(started, clock.instant()).toMillis());
            return true;
        } catch (RuntimeException e) {
            long elapsedMs = Duration.between(started, clock.instant()).toMillis();
            log.error("Scheduled task {} failed after {}ms", taskName, elapsedMs, e);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("error", e.getClass().getSimpleName() + ": " + e.getMessage());
            metadata.put("startedAt", started.toString());
            metadata.put("elapsedMs", elapsedMs);
            auditEventService.record(AuditAction.TASK_FAILED, taskName, "Scheduled task failed: " + taskName, metadata);
            return false;
        } finally {
            if (previousCorrelation != null) {
                MDC.put("correlationId", previousCorrelation);
            } else {
                MDC.remove("correlationId");
            }
        }
    }
}
