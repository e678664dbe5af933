package com.vtrade.backend.service.admin;

import com.vtrade.backend.dto.AdminOverrideSummary;
import com.vtrade.backend.dto.AdminPatchPositionRequest;
import com.vtrade.backend.dto.AdminPatchPositionResponse;
import com.vtrade.backend.dto.OrderResponse;
import com.vtrade.backend.dto.PositionRelatedResponse;
import com.vtrade.backend.dto.PositionResponse;
import com.vtrade.backend.dto.TransactionResponse;
import com.vtrade.backend.exception.BadRequestException;
import com.vtrade.backend.exception.ConflictException;
import com.vtrade.backend.exception.NotFoundException;
import com.vtrade.backend.model.LedgerTransaction;
import com.vtrade.backend.model.OrderStatus;
import com.vtrade.backend.model.Position;
import com.vtrade.backend.model.TradeOrder;
import com.vtrade.backend.repository.LedgerTransactionRepository;
import com.vtrade.backend.repository.PositionRepository;
import com.vtrade.backend.repository.TradeOrderRepository;
import com.vtrade.backend.service.AuditEventService;
import com.vtrade.backend.service.ledger.LedgerService;
import com.vtrade.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Admin corrections to positions. Everything in one patch commits or rolls back together: a refused fund
 * debit leaves the position, its orders and its transactions untouched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AdminPositionService {

    private final PositionRepository positionRepository;
    private final TradeOrderRepository orderRepository;
    private final LedgerTransactionRepository transactionRepository;
    private final LedgerService ledgerService;
    private final AuditEventService auditEventService;

    @Transactional
    public AdminPatchPositionResponse patchPosition(Long adminUserId, Long positionId, AdminPatchPositionRequest request) {
        if (request == null || !request.hasChanges()) {
            throw new BadRequestException("No updates provided");
        }
        String symbol = null;
        if (request.getSymbol() != null) {
            if (request.getSymbol().isBlank()) {
                throw new BadRequestException("symbol must not be blank");
            }
            symbol = request.getSymbol().trim().toUpperCase(Locale.ROOT);
        }
        Long accountId = positionRepository.findTradingAccountIdById(positionId)
                .orElseThrow(() -> new NotFoundException("Position not found"));
        ledgerService.lockAccount(accountId);
        Position position = positionRepository.findById(positionId)
                .orElseThrow(() -> new NotFoundException("Position not found"));

        if (!position.isOpen() && newQuantityOf(request, 0) != 0) {
            throw new ConflictException("Position #" + positionId + " is closed; open new exposure with an order");
        }

        int oldQuantity = Math.abs(position.getQuantity());
        BigDecimal oldAverage = MoneyUtils.scale(position.getAveragePrice());
        int newQuantity = newQuantityOf(request, oldQuantity);
        BigDecimal newAverage = request.getAveragePrice() != null ? MoneyUtils.scale(request.getAveragePrice()) : oldAverage;
        BigDecimal oldValue = MoneyUtils.multiply(oldAverage, oldQuantity);
        BigDecimal newValue = MoneyUtils.multiply(newAverage, newQuantity);
        BigDecimal valueDelta = MoneyUtils.subtract(newValue, oldValue);
        boolean quantityChanged = newQuantity != oldQuantity;
        boolean averageChanged = newAverage.compareTo(oldAverage) != 0;
        boolean symbolChanged = symbol != null && !symbol.equals(position.getSymbol());
        boolean closing = position.isOpen() && newQuantity == 0;
        BigDecimal releasable = closing ? MoneyUtils.scale(position.getBlockedMargin()) : MoneyUtils.ZERO;

        LocalDateTime now = LocalDateTime.now();
        int sign = position.getQuantity() < 0 ? -1 : 1;
        position.setQuantity(sign * newQuantity);
        position.setAveragePrice(newAverage);
        if (symbol != null) {
            position.setSymbol(symbol);
        }
        if (request.isStopLossPresent()) {
            position.setStopLoss(request.getStopLoss() == null ? null : MoneyUtils.scale(request.getStopLoss()));
        }
        if (request.isTargetPresent()) {
            position.setTarget(request.getTarget() == null ? null : MoneyUtils.scale(request.getTarget()));
        }
        if (request.getUnrealizedPnl() != null) {
            position.setUnrealizedPnl(MoneyUtils.scale(request.getUnrealizedPnl()));
        }
        if (request.getDayPnl() != null) {
            position.setDayPnl(MoneyUtils.scale(request.getDayPnl()));
        }
        if (closing) {
            position.setBlockedMargin(MoneyUtils.ZERO);
            position.setClosedAt(now);
            if (request.getUnrealizedPnl() == null) {
                position.setUnrealizedPnl(MoneyUtils.ZERO);
            }
            if (request.getDayPnl() == null) {
                position.setDayPnl(MoneyUtils.ZERO);
            }
        }
        position.setUpdatedAt(now);
        position = positionRepository.saveAndFlush(position);

        int ordersUpdated = 0;
        if (request.isCascadeToOrders() && (symbolChanged || quantityChanged || averageChanged)) {
            ordersUpdated = cascadeToOrders(positionId, symbol, quantityChanged ? newQuantity : null,
                    averageChanged ? newAverage : null, now);
        }
        int transactionsUpdated = 0;
        if (request.isCascadeToTransactions() && valueDelta.signum() != 0) {
            transactionsUpdated = cascadeToTransactions(positionId, oldValue, valueDelta);
        }

        BigDecimal marginReleased = MoneyUtils.ZERO;
        if (releasable.signum() > 0) {
            ledgerService.releaseMargin(accountId, releasable,
                    "Margin released by admin close of position #" + positionId, null, positionId);
            marginReleased = releasable;
        }
        LedgerTransaction adjustment = null;
        if (request.isManageFunds() && valueDelta.signum() != 0) {
            String direction = valueDelta.signum() > 0 ? "Credit" : "Debit";
            adjustment = ledgerService.adjust(accountId, valueDelta,
                    "Position adjustment: " + position.getSymbol() + " - " + direction + " for value change", positionId);
        }

        AdminOverrideSummary summary = AdminOverrideSummary.builder()
                .oldValue(oldValue)
                .newValue(newValue)
                .valueDelta(valueDelta)
                .fundsAdjusted(adjustment != null)
                .fundTransactionId(adjustment == null ? null : adjustment.getId())
                .marginReleased(marginReleased)
                .ordersUpdated(ordersUpdated)
                .transactionsUpdated(transactionsUpdated)
                .build();
        log.info("Admin position override positionId={} accountId={} qty {}->{} avg {}->{} delta={} funds={} orders={} transactions={}",
                positionId, accountId, oldQuantity, newQuantity, oldAverage, newAverage, valueDelta,
                summary.isFundsAdjusted(), ordersUpdated, transactionsUpdated);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("oldQuantity", oldQuantity);
        metadata.put("newQuantity", newQuantity);
        metadata.put("oldAveragePrice", oldAverage.toPlainString());
        metadata.put("newAveragePrice", newAverage.toPlainString());
        metadata.put("valueDelta", valueDelta.toPlainString());
        metadata.put("manageFunds", request.isManageFunds());
        metadata.put("cascadeToOrders", request.isCascadeToOrders());
        metadata.put("cascadeToTransactions", request.isCascadeToTransactions());
        auditEventService.recordEvent(adminUserId, "admin", "POSITION_OVERRIDE", "position", positionId,
                "Admin override of position #" + positionId, metadata);

        Position updated = positionRepository.findById(positionId).orElse(position);
        return AdminPatchPositionResponse.builder()
                .position(PositionResponse.from(updated))
                .summary(summary)
                .build();
    }

    private static int newQuantityOf(AdminPatchPositionRequest request, int oldQuantity) {
        if (request.getAction() == AdminPatchPositionRequest.Action.CLOSE) {
            return 0;
        }
        return request.getQuantity() != null ? request.getQuantity() : oldQuantity;
    }

    @Transactional(readOnly = true)
    public PositionRelatedResponse related(Long positionId) {
        Position position = positionRepository.findById(positionId)
                .orElseThrow(() -> new NotFoundException("Position not found"));
        List<TradeOrder> orders = orderRepository.findByPositionIdOrderByCreatedAtAsc(positionId);
        return PositionRelatedResponse.builder()
                .position(PositionResponse.from(position))
                .orders(orders.stream().map(OrderResponse::from).toList())
                .transactions(linkedTransactions(positionId, orders).stream().map(TransactionResponse::from).toList())
                .build();
    }

    private int cascadeToOrders(Long positionId, String symbol, Integer quantity, BigDecimal averagePrice,
                                LocalDateTime now) {
        List<TradeOrder> orders = orderRepository.findByPositionIdAndStatus(positionId, OrderStatus.EXECUTED);
        for (TradeOrder order : orders) {
            if (symbol != null) {
                order.setSymbol(symbol);
            }
            if (quantity != null) {
                order.setQuantity(quantity);
                order.setFilledQuantity(quantity);
            }
            if (averagePrice != null) {
                order.setAveragePrice(averagePrice);
            }
            order.setUpdatedAt(now);
        }
        orderRepository.saveAll(orders);
        return orders.size();
    }

    /**
     * Rescales position-value transactions proportionally to the value change. Margin and charge entries are
     * left alone, and nothing is rescaled when the position had no value to scale from.
     */
    private int cascadeToTransactions(Long positionId, BigDecimal oldValue, BigDecimal valueDelta) {
        if (oldValue.signum() == 0) {
            log.info("Skipping transaction cascade for positionId={}: previous value is zero", positionId);
            return 0;
        }
        List<TradeOrder> orders = orderRepository.findByPositionIdOrderByCreatedAtAsc(positionId);
        int updated = 0;
        for (LedgerTransaction transaction : linkedTransactions(positionId, orders)) {
            if (transaction.getCategory() == null || !transaction.getCategory().isPositionValue()) {
                continue;
            }
            BigDecimal amount = transaction.getAmount();
            BigDecimal share = amount.divide(oldValue, MathContext.DECIMAL64).multiply(valueDelta, MathContext.DECIMAL64);
            transaction.setAmount(MoneyUtils.max(MoneyUtils.ZERO, MoneyUtils.add(amount, share)));
            transactionRepository.save(transaction);
            updated++;
        }
        return updated;
    }

    private List<LedgerTransaction> linkedTransactions(Long positionId, List<TradeOrder> orders) {
        Map<Long, LedgerTransaction> byId = new LinkedHashMap<>();
        transactionRepository.findByPositionIdOrderByIdAsc(positionId).forEach(t -> byId.put(t.getId(), t));
        for (TradeOrder order : orders) {
            transactionRepository.findByOrderIdOrderByIdAsc(order.getId()).forEach(t -> byId.putIfAbsent(t.getId(), t));
        }
        return new ArrayList<>(byId.values());
    }
}
