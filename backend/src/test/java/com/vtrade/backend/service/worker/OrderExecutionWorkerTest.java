package com.vtrade.backend.service.worker;

import com.vtrade.backend.config.WorkerProperties;
import com.vtrade.backend.model.TradeOrder;
import com.vtrade.backend.repository.TradeOrderRepository;
import com.vtrade.backend.service.TradingMetrics;
import com.vtrade.backend.service.order.OrderExecutionService;
import com.vtrade.backend.service.order.OrderExecutionService.ExecutionResult;
import com.vtrade.backend.service.order.OrderExecutionService.Outcome;
import com.vtrade.backend.service.worker.OrderExecutionWorker.ProcessPendingOrdersResult;
import com.vtrade.backend.util.MoneyUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OrderExecutionWorkerTest {

    private TradeOrderRepository orderRepository;
    private OrderExecutionService executionService;
    private WorkerHeartbeatService heartbeatService;
    private TradingMetrics tradingMetrics;
    private OrderExecutionWorker worker;

    @BeforeEach
    void setUp() {
        orderRepository = mock(TradeOrderRepository.class);
        executionService = mock(OrderExecutionService.class);
        heartbeatService = mock(WorkerHeartbeatService.class);
        tradingMetrics = mock(TradingMetrics.class);
        worker = new OrderExecutionWorker(orderRepository, executionService, heartbeatService, new WorkerProperties(),
                tradingMetrics);
    }

    @Test
    void failingOrderIsRejectedAndTheBatchContinues() {
        when(orderRepository.findDuePending(any(LocalDateTime.class), any(Pageable.class)))
                .thenReturn(List.of(order(1L), order(2L), order(3L)));
        when(executionService.execute(1L)).thenReturn(result(1L, Outcome.EXECUTED));
        when(executionService.execute(2L)).thenThrow(new IllegalStateException("boom"));
        when(executionService.execute(3L)).thenReturn(result(3L, Outcome.SKIPPED));
        when(executionService.rejectPending(eq(2L), anyString())).thenReturn(result(2L, Outcome.REJECTED));

        ProcessPendingOrdersResult result = worker.processPendingOrders();

        assertThat(result.scanned()).isEqualTo(3);
        assertThat(result.executed()).isEqualTo(1);
        assertThat(result.rejected()).isEqualTo(1);
        assertThat(result.skipped()).isEqualTo(1);
        assertThat(result.errors()).isEqualTo(1);
        verify(executionService).execute(3L);
        verify(executionService).rejectPending(eq(2L), anyString());
        verify(tradingMetrics).recordWorkerError();
        verify(heartbeatService).beat(eq("order-execution"), eq(3), eq(2), eq(1), eq(1), anyLong());
    }

    @Test
    void failedCompensationLeavesOrderForNextPass() {
        when(orderRepository.findDuePending(any(LocalDateTime.class), any(Pageable.class)))
                .thenReturn(List.of(order(7L)));
        when(executionService.execute(7L)).thenThrow(new IllegalStateException("db down"));
        when(executionService.rejectPending(eq(7L), anyString())).thenThrow(new IllegalStateException("still down"));

        ProcessPendingOrdersResult result = worker.processPendingOrders(10);

        assertThat(result.errors()).isEqualTo(1);
        assertThat(result.rejected()).isZero();
    }

    @Test
    void emptyPassStillBeats() {
        when(orderRepository.findDuePending(any(LocalDateTime.class), any(Pageable.class))).thenReturn(List.of());

        ProcessPendingOrdersResult result = worker.processPendingOrders();

        assertThat(result.scanned()).isZero();
        verify(executionService, never()).execute(anyLong());
        verify(heartbeatService).beat(eq("order-execution"), eq(0), eq(0), eq(0), eq(0), anyLong());
    }

    @Test
    void batchLimitIsClamped() {
        assertThat(OrderExecutionWorker.clamp(0)).isEqualTo(1);
        assertThat(OrderExecutionWorker.clamp(50)).isEqualTo(50);
        assertThat(OrderExecutionWorker.clamp(10_000)).isEqualTo(OrderExecutionWorker.MAX_BATCH);
    }

    private TradeOrder order(Long id) {
        return TradeOrder.builder().id(id).symbol("INFY").quantity(1).build();
    }

    private ExecutionResult result(Long id, Outcome outcome) {
        return new ExecutionResult(id, outcome, BigDecimal.ONE, null, null, MoneyUtils.ZERO, MoneyUtils.ZERO, null);
    }
}
