package com.vtrade.backend.service.position;

import com.vtrade.backend.config.TradingProperties;
import com.vtrade.backend.dto.ClosePositionRequest;
import com.vtrade.backend.dto.ClosePositionResponse;
import com.vtrade.backend.dto.PlaceOrderRequest;
import com.vtrade.backend.exception.BadRequestException;
import com.vtrade.backend.exception.ConflictException;
import com.vtrade.backend.model.OrderSide;
import com.vtrade.backend.model.OrderStatus;
import com.vtrade.backend.model.OrderType;
import com.vtrade.backend.model.Position;
import com.vtrade.backend.model.TradeOrder;
import com.vtrade.backend.model.TradingAccount;
import com.vtrade.backend.repository.TradeOrderRepository;
import com.vtrade.backend.service.ledger.LedgerService;
import com.vtrade.backend.service.order.OrderExecutionService;
import com.vtrade.backend.service.order.OrderExecutionService.ExecutionResult;
import com.vtrade.backend.service.order.OrderService;
import com.vtrade.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Closes a position by sending an opposite-side market exit order through the normal placement and
 * execution path, so exits are settled exactly like any other fill. Quantity already covered by PENDING exit
 * orders is not closable a second time.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PositionCloseService {

    private final PositionService positionService;
    private final OrderService orderService;
    private final OrderExecutionService orderExecutionService;
    private final LedgerService ledgerService;
    private final TradeOrderRepository orderRepository;
    private final TradingProperties tradingProperties;

    @Transactional
    public ClosePositionResponse closePosition(Long userId, Long positionId, ClosePositionRequest request) {
        TradingAccount account = ledgerService.getAccountForUser(userId);
        ledgerService.lockAccount(account.getId());
        Position position = positionService.getPosition(account.getId(), positionId);
        if (!position.isOpen()) {
            throw new ConflictException("Position is already closed");
        }
        OrderSide exitSide = position.isLong() ? OrderSide.SELL : OrderSide.BUY;
        long pendingExit = orderRepository.sumPendingExitQuantity(account.getId(), position.getInstrumentId(),
                position.getProductType(), exitSide);
        int open = Math.abs(position.getQuantity());
        int closable = (int) Math.max(0, open - pendingExit);
        if (closable == 0) {
            throw new ConflictException("Exit orders are already pending for the whole open quantity");
        }
        int quantity = request != null && request.getQuantity() != null ? request.getQuantity() : closable;
        if (quantity <= 0) {
            throw new BadRequestException("Quantity must be greater than zero");
        }
        if (quantity > closable) {
            throw new BadRequestException("Cannot close " + quantity + " of an open quantity of " + open
                    + " with " + pendingExit + " already pending exit");
        }

        PlaceOrderRequest exit = PlaceOrderRequest.builder()
                .symbol(position.getSymbol())
                .quantity(quantity)
                .orderType(OrderType.MARKET)
                .orderSide(exitSide)
                .productType(position.getProductType())
                .build();
        boolean fastPath = tradingProperties.getOrders().isCloseFastPath();
        long delay = fastPath ? 0 : tradingProperties.getOrders().getExecutionDelayMs();
        TradeOrder exitOrder = orderService.placeForAccount(account.getId(), exit, true, delay);
        log.info("Exit order placed positionId={} exitOrderId={} side={} qty={} fastPath={}",
                positionId, exitOrder.getId(), exitSide, quantity, fastPath);

        if (!fastPath) {
            return ClosePositionResponse.builder()
                    .positionId(positionId)
                    .exitOrderId(exitOrder.getId())
                    .exitOrderStatus(exitOrder.getStatus())
                    .closedQuantity(0)
                    .realizedPnl(MoneyUtils.ZERO)
                    .charges(MoneyUtils.ZERO)
                    .remainingQuantity(open)
                    .message("Exit order queued")
                    .build();
        }

        ExecutionResult result = orderExecutionService.execute(exitOrder.getId());
        Position after = positionService.getPosition(positionId);
        boolean executed = result.outcome() == OrderExecutionService.Outcome.EXECUTED;
        return ClosePositionResponse.builder()
                .positionId(positionId)
                .exitOrderId(exitOrder.getId())
                .exitOrderStatus(statusOf(result, exitOrder))
                .closedQuantity(executed ? quantity : 0)
                .exitPrice(result.fillPrice())
                .realizedPnl(result.realizedPnl())
                .charges(result.charges())
                .remainingQuantity(Math.abs(after.getQuantity()))
                .message(executed ? "Position closed" : result.reason())
                .build();
    }

    private OrderStatus statusOf(ExecutionResult result, TradeOrder exitOrder) {
        return switch (result.outcome()) {
            case EXECUTED -> OrderStatus.EXECUTED;
            case REJECTED -> OrderStatus.REJECTED;
            default -> exitOrder.getStatus();
        };
    }
}
