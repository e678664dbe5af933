package com.vtrade.backend.service.worker;

import com.vtrade.backend.config.WorkerProperties;
import com.vtrade.backend.model.TradeOrder;
import com.vtrade.backend.repository.TradeOrderRepository;
import com.vtrade.backend.service.TradingMetrics;
import com.vtrade.backend.service.order.OrderExecutionService;
import com.vtrade.backend.service.order.OrderExecutionService.ExecutionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One pass over due PENDING orders, oldest first. Every order is executed in its own transaction; an order
 * whose execution throws is rejected with its reservation released, and the pass moves on.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrderExecutionWorker {

    static final int MAX_BATCH = 200;

    private final TradeOrderRepository orderRepository;
    private final OrderExecutionService orderExecutionService;
    private final WorkerHeartbeatService heartbeatService;
    private final WorkerProperties workerProperties;
    private final TradingMetrics tradingMetrics;

    public ProcessPendingOrdersResult processPendingOrders() {
        return processPendingOrders(workerProperties.getOrderExecution().getBatchLimit());
    }

    public ProcessPendingOrdersResult processPendingOrders(int limit) {
        long started = System.currentTimeMillis();
        int batch = clamp(limit);
        List<TradeOrder> due = orderRepository.findDuePending(LocalDateTime.now(), PageRequest.of(0, batch));
        int executed = 0;
        int rejected = 0;
        int skipped = 0;
        int errors = 0;

        for (TradeOrder order : due) {
            try {
                ExecutionResult result = orderExecutionService.execute(order.getId());
                switch (result.outcome()) {
                    case EXECUTED -> executed++;
                    case REJECTED -> rejected++;
                    default -> skipped++;
                }
            } catch (Exception e) {
                errors++;
                log.error("Order execution failed orderId={}", order.getId(), e);
                tradingMetrics.recordWorkerError();
                if (compensate(order.getId(), e)) {
                    rejected++;
                }
            }
        }

        long elapsed = System.currentTimeMillis() - started;
        ProcessPendingOrdersResult result = new ProcessPendingOrdersResult(due.size(), executed, rejected, skipped,
                errors, elapsed);
        heartbeatService.beat(workerProperties.getOrderExecution().getWorkerId(), due.size(), executed + rejected,
                skipped, errors, elapsed);
        if (!due.isEmpty()) {
            log.info("Order execution pass scanned={} executed={} rejected={} skipped={} errors={} elapsedMs={}",
                    due.size(), executed, rejected, skipped, errors, elapsed);
        }
        return result;
    }

    private boolean compensate(Long orderId, Exception cause) {
        try {
            ExecutionResult result = orderExecutionService.rejectPending(orderId,
                    "Execution failed: " + cause.getClass().getSimpleName());
            return result.outcome() == OrderExecutionService.Outcome.REJECTED;
        } catch (Exception e) {
            log.error("Compensation failed orderId={}; order stays PENDING for the next pass", orderId, e);
            return false;
        }
    }

    static int clamp(int limit) {
        return Math.max(1, Math.min(MAX_BATCH, limit));
    }

    public record ProcessPendingOrdersResult(int scanned, int executed, int rejected, int skipped, int errors,
                                             long elapsedMs) {
    }
}
