package com.vtrade.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TradingMetrics {

    private final MeterRegistry meterRegistry;

    private Counter ordersPlacedCounter;
    private Counter ordersExecutedCounter;
    private Counter ordersRejectedCounter;
    private Counter ordersCancelledCounter;
    private Counter positionMarksCounter;
    private Counter workerErrorsCounter;
    private Counter riskAlertsCounter;
    private Counter riskSquareOffsCounter;

    @PostConstruct
    void init() {
        ordersPlacedCounter = Counter.builder("orders_placed_total").register(meterRegistry);
        ordersExecutedCounter = Counter.builder("orders_executed_total").register(meterRegistry);
        ordersRejectedCounter = Counter.builder("orders_rejected_total").register(meterRegistry);
        ordersCancelledCounter = Counter.builder("orders_cancelled_total").register(meterRegistry);
        positionMarksCounter = Counter.builder("position_marks_updated_total").register(meterRegistry);
        workerErrorsCounter = Counter.builder("worker_errors_total").register(meterRegistry);
        riskAlertsCounter = Counter.builder("risk_alerts_total").register(meterRegistry);
        riskSquareOffsCounter = Counter.builder("risk_square_offs_total").register(meterRegistry);
    }

    public void recordOrderPlaced() {
        increment(ordersPlacedCounter);
    }

    public void recordOrderExecuted() {
        increment(ordersExecutedCounter);
    }

    public void recordOrderRejected() {
        increment(ordersRejectedCounter);
    }

    public void recordOrderCancelled() {
        increment(ordersCancelledCounter);
    }

    public void recordPositionMarks(int count) {
        if (positionMarksCounter != null && count > 0) {
            positionMarksCounter.increment(count);
        }
    }

    public void recordWorkerError() {
        increment(workerErrorsCounter);
    }

    public void recordRiskAlert() {
        increment(riskAlertsCounter);
    }

    public void recordRiskSquareOffs(int count) {
        if (riskSquareOffsCounter != null && count > 0) {
            riskSquareOffsCounter.increment(count);
        }
    }

    private void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}
