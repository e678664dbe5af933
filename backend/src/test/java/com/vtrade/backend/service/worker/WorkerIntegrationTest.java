package com.vtrade.backend.service.worker;

import com.vtrade.backend.IntegrationTestSupport;
import com.vtrade.backend.model.Instrument;
import com.vtrade.backend.model.OrderSide;
import com.vtrade.backend.model.OrderStatus;
import com.vtrade.backend.model.Position;
import com.vtrade.backend.model.TradeOrder;
import com.vtrade.backend.model.TradingAccount;
import com.vtrade.backend.model.WorkerHeartbeat;
import com.vtrade.backend.service.order.OrderService;
import com.vtrade.backend.service.worker.OrderExecutionWorker.ProcessPendingOrdersResult;
import com.vtrade.backend.service.worker.PositionPnlWorker.PositionPnlResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerIntegrationTest extends IntegrationTestSupport {

    private static final Long USER_ID = 31L;

    @Autowired
    private OrderService orderService;

    @Autowired
    private OrderExecutionWorker orderExecutionWorker;

    @Autowired
    private PositionPnlWorker positionPnlWorker;

    @Test
    void executionPassSettlesDueOrdersAndBeats() {
        TradingAccount account = fundedAccount(USER_ID, "100000");
        Instrument reliance = instrument("RELIANCE", "NSE", "2500", "2480");
        instrument("TCS", "NSE", "3500", "3490");
        TradeOrder first = orderService.placeOrder(USER_ID, market("RELIANCE", OrderSide.BUY, 10));
        TradeOrder second = orderService.placeOrder(USER_ID, market("TCS", OrderSide.BUY, 2));
        Instrument halted = instrumentRepository.findById(reliance.getId()).orElseThrow();
        halted.setTradable(false);
        instrumentRepository.save(halted);

        ProcessPendingOrdersResult result = orderExecutionWorker.processPendingOrders(50);

        assertThat(result.scanned()).isEqualTo(2);
        assertThat(result.executed()).isEqualTo(1);
        assertThat(result.rejected()).isEqualTo(1);
        assertThat(result.errors()).isZero();
        assertThat(orderRepository.findById(first.getId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.REJECTED);
        assertThat(orderRepository.findById(second.getId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.EXECUTED);

        WorkerHeartbeat heartbeat = heartbeatRepository.findByWorkerId("order-execution").orElseThrow();
        assertThat(heartbeat.getScanned()).isEqualTo(2);
        assertThat(heartbeat.getProcessed()).isEqualTo(2);
        assertThat(heartbeat.getLastRunAt()).isNotNull();
        assertLedgerConsistent(account);

        ProcessPendingOrdersResult idle = orderExecutionWorker.processPendingOrders(50);
        assertThat(idle.scanned()).isZero();
    }

    @Test
    void pnlPassMarksOpenPositions() {
        TradingAccount account = fundedAccount(USER_ID, "100000");
        Instrument reliance = instrument("RELIANCE", "NSE", "2500", "2480");
        orderService.placeOrder(USER_ID, market("RELIANCE", OrderSide.BUY, 10));
        orderExecutionWorker.processPendingOrders(50);
        setLastPrice(reliance, "2550");

        PositionPnlResult result = positionPnlWorker.processPositionPnl(100);

        assertThat(result.scanned()).isEqualTo(1);
        assertThat(result.updated()).isEqualTo(1);
        List<Position> positions = positionRepository.findByTradingAccountIdOrderByOpenedAtDesc(account.getId());
        Position position = positions.get(0);
        assertThat(position.getUnrealizedPnl()).isEqualByComparingTo("500");
        assertThat(position.getDayPnl()).isEqualByComparingTo("700");
        assertThat(position.getLastPrice()).isEqualByComparingTo("2550");
        assertThat(heartbeatRepository.findByWorkerId("position-pnl")).isPresent();

        PositionPnlResult unchanged = positionPnlWorker.processPositionPnl(100);
        assertThat(unchanged.updated()).isZero();
        assertThat(unchanged.skipped()).isEqualTo(1);
    }
}
