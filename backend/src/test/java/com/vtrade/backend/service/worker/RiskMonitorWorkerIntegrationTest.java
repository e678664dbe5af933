package com.vtrade.backend.service.worker;

import com.vtrade.backend.IntegrationTestSupport;
import com.vtrade.backend.config.TradingProperties;
import com.vtrade.backend.model.Instrument;
import com.vtrade.backend.model.OrderSide;
import com.vtrade.backend.model.OrderStatus;
import com.vtrade.backend.model.RiskAlert;
import com.vtrade.backend.model.RiskAlertSeverity;
import com.vtrade.backend.model.RiskAlertType;
import com.vtrade.backend.model.TradeOrder;
import com.vtrade.backend.model.TradingAccount;
import com.vtrade.backend.service.order.OrderExecutionService;
import com.vtrade.backend.service.order.OrderService;
import com.vtrade.backend.service.worker.RiskMonitorWorker.RiskMonitorResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RiskMonitorWorkerIntegrationTest extends IntegrationTestSupport {

    private static final Long USER_ID = 41L;

    @Autowired
    private RiskMonitorWorker riskMonitorWorker;

    @Autowired
    private OrderService orderService;

    @Autowired
    private OrderExecutionService orderExecutionService;

    @Autowired
    private TradingProperties tradingProperties;

    private TradingAccount account;
    private Instrument reliance;
    private Long relianceId;

    @BeforeEach
    void openPosition() {
        account = fundedAccount(USER_ID, "10000");
        reliance = instrument("RELIANCE", "NSE", "2500", "2480");
        relianceId = buy("RELIANCE", 10);
    }

    @AfterEach
    void restoreFastPath() {
        tradingProperties.getOrders().setCloseFastPath(true);
    }

    private Long buy(String symbol, int quantity) {
        TradeOrder order = orderService.placeOrder(USER_ID, market(symbol, OrderSide.BUY, quantity));
        return orderExecutionService.execute(order.getId()).positionId();
    }

    @Test
    void lossPastWarningRaisesOneAlertAndClosesNothing() {
        // loss 16000 against funds 9983.1912 + 9858.1912
        setLastPrice(reliance, "900");

        RiskMonitorResult first = riskMonitorWorker.processAccounts(50);
        RiskMonitorResult second = riskMonitorWorker.processAccounts(50);

        assertThat(first.accounts()).isEqualTo(1);
        assertThat(first.breached()).isEqualTo(1);
        assertThat(first.alertsRaised()).isEqualTo(1);
        assertThat(first.positionsClosed()).isZero();
        assertThat(second.alertsRaised()).isZero();
        List<RiskAlert> alerts = riskAlertRepository.findAll();
        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.getType()).isEqualTo(RiskAlertType.LARGE_LOSS);
            assertThat(alert.getSeverity()).isEqualTo(RiskAlertSeverity.HIGH);
            assertThat(alert.getUnrealizedLoss()).isEqualByComparingTo("16000");
            assertThat(alert.getUtilization()).isEqualByComparingTo("0.8064");
            assertThat(alert.isResolved()).isFalse();
        });
        assertThat(positionRepository.findById(relianceId).orElseThrow().getQuantity()).isEqualTo(10);
        assertThat(heartbeatRepository.findByWorkerId("risk-monitor")).isPresent();
    }

    @Test
    void recoveryBelowWarningResolvesTheAlert() {
        setLastPrice(reliance, "900");
        riskMonitorWorker.processAccounts(50);
        setLastPrice(reliance, "2500");

        RiskMonitorResult result = riskMonitorWorker.processAccounts(50);

        assertThat(result.breached()).isZero();
        assertThat(riskAlertRepository.findAll()).singleElement().satisfies(alert -> {
            assertThat(alert.isResolved()).isTrue();
            assertThat(alert.getResolvedAt()).isNotNull();
        });
    }

    @Test
    void lossPastAutoCloseSquaresOffLosingPositionsOnly() {
        Instrument tcs = instrument("TCS", "NSE", "1000", "990");
        Long tcsId = buy("TCS", 10);
        setLastPrice(reliance, "500");
        setLastPrice(tcs, "1100");

        RiskMonitorResult result = riskMonitorWorker.processAccounts(50);

        assertThat(result.positionsClosed()).isEqualTo(1);
        assertThat(result.errors()).isZero();
        assertThat(positionRepository.findById(relianceId).orElseThrow().getQuantity()).isZero();
        assertThat(positionRepository.findById(relianceId).orElseThrow().getRealizedPnl())
                .isEqualByComparingTo("-20000");
        assertThat(positionRepository.findById(tcsId).orElseThrow().getQuantity()).isEqualTo(10);
        assertThat(riskAlertRepository.findAll()).singleElement().satisfies(alert -> {
            assertThat(alert.getType()).isEqualTo(RiskAlertType.MARGIN_CALL);
            assertThat(alert.getSeverity()).isEqualTo(RiskAlertSeverity.CRITICAL);
            assertThat(alert.getPositionsClosed()).isEqualTo(1);
        });
        assertLedgerConsistent(account);
    }

    @Test
    void queuedSquareOffIsNotRepeatedOnTheNextPass() {
        tradingProperties.getOrders().setCloseFastPath(false);
        setLastPrice(reliance, "500");

        RiskMonitorResult first = riskMonitorWorker.processAccounts(50);
        RiskMonitorResult second = riskMonitorWorker.processAccounts(50);

        assertThat(first.positionsClosed()).isEqualTo(1);
        assertThat(second.positionsClosed()).isZero();
        assertThat(second.alertsRaised()).isZero();
        assertThat(riskAlertRepository.findAll()).hasSize(1);
        assertThat(orderRepository.findByTradingAccountIdAndStatusOrderByCreatedAtDesc(account.getId(),
                OrderStatus.PENDING)).singleElement().satisfies(order -> assertThat(order.isExitOrder()).isTrue());
        assertLedgerConsistent(account);
    }

    @Test
    void profitableAccountIsLeftAlone() {
        setLastPrice(reliance, "2600");

        RiskMonitorResult result = riskMonitorWorker.processAccounts(50);

        assertThat(result.accounts()).isEqualTo(1);
        assertThat(result.breached()).isZero();
        assertThat(riskAlertRepository.count()).isZero();
    }

    @Test
    void utilizationTreatsExhaustedFundsAsFullyUsed() {
        assertThat(RiskMonitorWorker.utilization(new BigDecimal("50"), new BigDecimal("100")))
                .isEqualByComparingTo("0.5");
        assertThat(RiskMonitorWorker.utilization(new BigDecimal("10"), BigDecimal.ZERO)).isEqualByComparingTo("1");
        assertThat(RiskMonitorWorker.utilization(BigDecimal.ZERO, new BigDecimal("-5"))).isEqualByComparingTo("0");
    }
}
