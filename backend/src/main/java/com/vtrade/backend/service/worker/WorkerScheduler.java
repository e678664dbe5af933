package com.vtrade.backend.service.worker;

import com.vtrade.backend.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Polling loops for the workers. Each is enabled per process, so an API node, an order-execution node, a P&L
 * node and a risk node can run from the same build. Fixed-delay scheduling keeps ticks of one loop from overlapping.
 */
@Configuration
public class WorkerScheduler {

    @Bean
    @ConditionalOnProperty(name = "vtrade.workers.order-execution.enabled", havingValue = "true")
    public OrderExecutionLoop orderExecutionLoop(OrderExecutionWorker worker, ScheduledTaskGuard guard) {
        return new OrderExecutionLoop(worker, guard);
    }

    @Bean
    @ConditionalOnProperty(name = "vtrade.workers.position-pnl.enabled", havingValue = "true")
    public PositionPnlLoop positionPnlLoop(PositionPnlWorker worker, ScheduledTaskGuard guard) {
        return new PositionPnlLoop(worker, guard);
    }

    @Bean
    @ConditionalOnProperty(name = "vtrade.workers.risk-monitor.enabled", havingValue = "true")
    public RiskMonitorLoop riskMonitorLoop(RiskMonitorWorker worker, ScheduledTaskGuard guard) {
        return new RiskMonitorLoop(worker, guard);
    }

    @RequiredArgsConstructor
    public static class OrderExecutionLoop {

        private final OrderExecutionWorker worker;
        private final ScheduledTaskGuard guard;

        @Scheduled(fixedDelayString = "${vtrade.workers.order-execution.interval-ms:750}")
        public void tick() {
            guard.run("order-execution", worker::processPendingOrders);
        }
    }

    @RequiredArgsConstructor
    public static class PositionPnlLoop {

        private final PositionPnlWorker worker;
        private final ScheduledTaskGuard guard;

        @Scheduled(fixedDelayString = "${vtrade.workers.position-pnl.interval-ms:3000}")
        public void tick() {
            guard.run("position-pnl", worker::processPositionPnl);
        }
    }

    @RequiredArgsConstructor
    public static class RiskMonitorLoop {

        private final RiskMonitorWorker worker;
        private final ScheduledTaskGuard guard;

        @Scheduled(fixedDelayString = "${vtrade.workers.risk-monitor.interval-ms:15000}")
        public void tick() {
            guard.run("risk-monitor", worker::processAccounts);
        }
    }
}
