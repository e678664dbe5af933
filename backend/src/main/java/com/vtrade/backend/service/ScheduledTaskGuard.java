package com.vtrade.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;

/**
 * Keeps a scheduled loop alive: a failing tick is logged and audited, and the next tick runs as usual.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final AuditEventService auditEventService;
    private final TradingMetrics tradingMetrics;

    public void run(String taskName, Runnable task) {
        MDC.put("task", taskName);
        try {
            task.run();
        } catch (Throwable t) {
            log.error("Scheduled task failed task={}", taskName, t);
            tradingMetrics.recordWorkerError();
            HashMap<String, Object> metadata = new HashMap<>();
            metadata.put("task", taskName);
            metadata.put("error", t.getMessage());
            metadata.put("timestamp", Instant.now().toString());
            try {
                auditEventService.recordEvent(0L, "scheduler", "TASK_FAILED",
                        "Scheduled task failed: " + taskName, metadata);
            } catch (RuntimeException auditFailure) {
                log.warn("Could not audit failed task={}: {}", taskName, auditFailure.getMessage());
            }
        } finally {
            MDC.remove("task");
        }
    }
}
