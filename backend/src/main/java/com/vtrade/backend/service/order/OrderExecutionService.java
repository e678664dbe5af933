package com.vtrade.backend.service.order;

import com.vtrade.backend.model.Instrument;
import com.vtrade.backend.model.OrderStatus;
import com.vtrade.backend.model.Position;
import com.vtrade.backend.model.TradeOrder;
import com.vtrade.backend.model.TradingAccount;
import com.vtrade.backend.repository.InstrumentRepository;
import com.vtrade.backend.repository.TradeOrderRepository;
import com.vtrade.backend.service.AuditEventService;
import com.vtrade.backend.service.TradingMetrics;
import com.vtrade.backend.service.ledger.LedgerService;
import com.vtrade.backend.service.position.PositionMath;
import com.vtrade.backend.service.position.PositionService;
import com.vtrade.backend.service.position.PositionService.FillPlan;
import com.vtrade.backend.service.position.PositionService.Settlement;
import com.vtrade.backend.service.risk.MarginCalculator.MarginBreakdown;
import com.vtrade.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Executes a single PENDING order against the simulated venue. The account row lock is taken before the
 * order is re-read, so settlement for one account is serialised across worker processes, and the order is
 * claimed with a compare-and-swap so a concurrent cancel or a second worker can never settle it again.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrderExecutionService {

    private final TradeOrderRepository orderRepository;
    private final InstrumentRepository instrumentRepository;
    private final LedgerService ledgerService;
    private final PositionService positionService;
    private final OrderService orderService;
    private final AuditEventService auditEventService;
    private final TradingMetrics tradingMetrics;

    @Transactional
    public ExecutionResult execute(Long orderId) {
        MDC.put("orderId", String.valueOf(orderId));
        try {
            Optional<Long> accountId = orderRepository.findTradingAccountIdById(orderId);
            if (accountId.isEmpty()) {
                return ExecutionResult.skipped(orderId, "Order not found");
            }
            TradingAccount account = ledgerService.lockAccount(accountId.get());
            TradeOrder order = orderRepository.findById(orderId).orElse(null);
            if (order == null || order.getStatus() != OrderStatus.PENDING) {
                return ExecutionResult.skipped(orderId, "Order is not pending");
            }

            Instrument instrument = instrumentRepository.findById(order.getInstrumentId()).orElse(null);
            if (instrument == null || !instrument.isTradable()) {
                return reject(order, instrument, "Instrument not tradable");
            }
            Optional<BigDecimal> price = orderService.priceChain(order, instrument);
            if (price.isEmpty()) {
                return reject(order, instrument, "No price available");
            }
            BigDecimal fillPrice = price.get();
            BigDecimal reserved = orderService.reservationOf(order, instrument);

            if (order.isExitOrder()) {
                int closable = closableQuantity(order);
                if (closable == 0) {
                    return reject(order, instrument, "Nothing left to close");
                }
                if (closable < order.getQuantity()) {
                    log.info("Exit order capped orderId={} requested={} closable={}", orderId, order.getQuantity(),
                            closable);
                    order.setQuantity(closable);
                }
            }

            FillPlan plan = positionService.planFill(order, fillPrice);
            MarginBreakdown breakdown = orderService.quote(account.getId(), instrument, order.getOrderSide(),
                    order.getProductType(), order.getQuantity(), fillPrice);
            BigDecimal shortfall = MoneyUtils.subtract(breakdown.totalCost(), reserved);
            if (shortfall.signum() > 0 && account.getAvailableMargin().compareTo(shortfall) < 0) {
                return reject(order, instrument, "Insufficient margin at fill price");
            }

            LocalDateTime now = LocalDateTime.now();
            if (orderRepository.markExecuted(orderId, fillPrice, now) == 0) {
                log.info("Execution lost race orderId={}", orderId);
                return ExecutionResult.skipped(orderId, "Order left PENDING concurrently");
            }

            Long accId = account.getId();
            if (shortfall.signum() > 0) {
                ledgerService.blockMargin(accId, shortfall, "Margin top-up at fill for order #" + orderId, orderId);
            } else if (shortfall.signum() < 0) {
                ledgerService.releaseMargin(accId, shortfall.negate(), "Margin excess released at fill for order #" + orderId,
                        orderId, null);
            }
            ledgerService.settleCharges(accId, breakdown.charges(), "Charges for order #" + orderId + " "
                    + order.getOrderSide() + " " + order.getQuantity() + " " + order.getSymbol(), orderId);
            Settlement settlement = positionService.settleFill(order, instrument, plan, breakdown.marginRequired());

            TradeOrder executed = orderRepository.findById(orderId).orElseThrow();
            executed.setPositionId(settlement.positionId());
            executed.setMarginBlocked(breakdown.marginRequired());
            executed.setChargesBlocked(breakdown.charges());
            orderRepository.save(executed);

            tradingMetrics.recordOrderExecuted();
            log.info("Order transition orderId={} from={} to={} fillPrice={} positionId={} realizedPnl={}",
                    orderId, OrderStatus.PENDING, OrderStatus.EXECUTED, fillPrice, settlement.positionId(),
                    settlement.realizedPnl());
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("fillPrice", fillPrice.toPlainString());
            metadata.put("charges", breakdown.charges().toPlainString());
            metadata.put("realizedPnl", settlement.realizedPnl().toPlainString());
            auditEventService.recordEvent(null, "order", "EXECUTED", "order", orderId,
                    "Order executed " + order.getOrderSide() + " " + order.getQuantity() + " " + order.getSymbol(), metadata);
            return new ExecutionResult(orderId, Outcome.EXECUTED, fillPrice, settlement.positionId(),
                    settlement.closedPositionId(), settlement.realizedPnl(), breakdown.charges(), null);
        } finally {
            MDC.remove("orderId");
        }
    }

    /**
     * Part of an exit order that still offsets the open position; an exit order never adds exposure.
     */
    private int closableQuantity(TradeOrder order) {
        int openQuantity = positionService.findOpen(order.getTradingAccountId(), order.getInstrumentId(),
                order.getProductType()).map(Position::getQuantity).orElse(0);
        return PositionMath.reducingQuantity(openQuantity, order.getOrderSide(), order.getQuantity());
    }

    /**
     * Compensation path used after {@link #execute} failed and rolled back: moves the order to REJECTED and
     * returns its reservation, if it is still PENDING.
     */
    @Transactional
    public ExecutionResult rejectPending(Long orderId, String reason) {
        TradeOrder order = orderRepository.findById(orderId).orElse(null);
        if (order == null || order.getStatus() != OrderStatus.PENDING) {
            return ExecutionResult.skipped(orderId, "Order is not pending");
        }
        Instrument instrument = instrumentRepository.findById(order.getInstrumentId()).orElse(null);
        return reject(order, instrument, reason);
    }

    private ExecutionResult reject(TradeOrder order, Instrument instrument, String reason) {
        String trimmed = reason != null && reason.length() > 255 ? reason.substring(0, 255) : reason;
        if (orderRepository.markRejected(order.getId(), trimmed, LocalDateTime.now()) == 0) {
            return ExecutionResult.skipped(order.getId(), "Order left PENDING concurrently");
        }
        BigDecimal released = orderService.reservationOf(order, instrument);
        ledgerService.releaseMargin(order.getTradingAccountId(), released,
                "Margin released for rejected order #" + order.getId(), order.getId(), null);
        tradingMetrics.recordOrderRejected();
        log.warn("Order transition orderId={} from={} to={} reason={} released={}", order.getId(),
                OrderStatus.PENDING, OrderStatus.REJECTED, trimmed, released);
        auditEventService.recordEvent(null, "order", "REJECTED", "order", order.getId(), trimmed,
                Map.of("released", released.toPlainString()));
        return new ExecutionResult(order.getId(), Outcome.REJECTED, null, null, null, MoneyUtils.ZERO,
                MoneyUtils.ZERO, trimmed);
    }

    public enum Outcome {
        EXECUTED,
        REJECTED,
        SKIPPED
    }

    public record ExecutionResult(Long orderId,
                                  Outcome outcome,
                                  BigDecimal fillPrice,
                                  Long positionId,
                                  Long closedPositionId,
                                  BigDecimal realizedPnl,
                                  BigDecimal charges,
                                  String reason) {

        static ExecutionResult skipped(Long orderId, String reason) {
            return new ExecutionResult(orderId, Outcome.SKIPPED, null, null, null, MoneyUtils.ZERO, MoneyUtils.ZERO, reason);
        }
    }
}
