package com.vtrade.backend.service.order;

import com.vtrade.backend.config.TradingProperties;
import com.vtrade.backend.dto.CancelOrderResponse;
import com.vtrade.backend.dto.MarginQuoteResponse;
import com.vtrade.backend.dto.ModifyOrderRequest;
import com.vtrade.backend.dto.PlaceOrderRequest;
import com.vtrade.backend.exception.BadRequestException;
import com.vtrade.backend.exception.ConflictException;
import com.vtrade.backend.exception.InvalidInstrumentException;
import com.vtrade.backend.exception.NotFoundException;
import com.vtrade.backend.model.Instrument;
import com.vtrade.backend.model.OrderSide;
import com.vtrade.backend.model.OrderStatus;
import com.vtrade.backend.model.OrderType;
import com.vtrade.backend.model.Position;
import com.vtrade.backend.model.ProductType;
import com.vtrade.backend.model.TradeOrder;
import com.vtrade.backend.model.TradingAccount;
import com.vtrade.backend.repository.InstrumentRepository;
import com.vtrade.backend.repository.TradeOrderRepository;
import com.vtrade.backend.service.AuditEventService;
import com.vtrade.backend.service.TradingMetrics;
import com.vtrade.backend.service.ledger.LedgerService;
import com.vtrade.backend.service.marketdata.PriceFeed;
import com.vtrade.backend.service.position.PositionMath;
import com.vtrade.backend.service.position.PositionService;
import com.vtrade.backend.service.risk.MarginCalculator;
import com.vtrade.backend.service.risk.MarginCalculator.MarginBreakdown;
import com.vtrade.backend.service.risk.MarginCalculator.MarginRequest;
import com.vtrade.backend.service.risk.RiskConfigService;
import com.vtrade.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Placement, modification and cancellation of orders. Placement reserves margin plus charges with a
 * conditional update and records the exact reservation on the order so cancellation and rejection can give
 * back precisely what was taken.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrderService {

    private final TradeOrderRepository orderRepository;
    private final InstrumentRepository instrumentRepository;
    private final LedgerService ledgerService;
    private final PositionService positionService;
    private final MarginCalculator marginCalculator;
    private final RiskConfigService riskConfigService;
    private final PriceFeed priceFeed;
    private final TradingProperties tradingProperties;
    private final AuditEventService auditEventService;
    private final TradingMetrics tradingMetrics;

    @Transactional
    public TradeOrder placeOrder(Long userId, PlaceOrderRequest request) {
        TradingAccount account = ledgerService.getAccountForUser(userId);
        return placeForAccount(account.getId(), request, false, tradingProperties.getOrders().getExecutionDelayMs());
    }

    @Transactional
    public TradeOrder placeOrderAsAdmin(Long adminUserId, Long userId, PlaceOrderRequest request) {
        TradeOrder order = placeOrder(userId, request);
        auditEventService.recordEvent(adminUserId, "order", "PLACED_BY_ADMIN", "order", order.getId(),
                "Order placed by admin for user " + userId,
                Map.of("userId", userId, "symbol", order.getSymbol(), "quantity", order.getQuantity()));
        return order;
    }

    /**
     * @param executionDelayMs earliest execution offset from now; 0 makes the order immediately due
     */
    @Transactional
    public TradeOrder placeForAccount(Long accountId, PlaceOrderRequest request, boolean exitOrder, long executionDelayMs) {
        validate(request);
        Instrument instrument = resolveTradableInstrument(request.getSymbol());
        BigDecimal limitPrice = request.getOrderType() == OrderType.LIMIT ? MoneyUtils.scale(request.getPrice()) : null;
        BigDecimal quotePrice = quotePrice(instrument, request.getOrderType(), limitPrice);
        MarginBreakdown breakdown = quote(accountId, instrument, request.getOrderSide(), request.getProductType(),
                request.getQuantity(), quotePrice);

        LocalDateTime now = LocalDateTime.now();
        TradeOrder order = orderRepository.save(TradeOrder.builder()
                .tradingAccountId(accountId)
                .instrumentId(instrument.getId())
                .symbol(instrument.getSymbol())
                .quantity(request.getQuantity())
                .orderType(request.getOrderType())
                .orderSide(request.getOrderSide())
                .productType(request.getProductType())
                .price(limitPrice)
                .quotedPrice(quotePrice)
                .filledQuantity(0)
                .status(OrderStatus.PENDING)
                .marginBlocked(breakdown.marginRequired())
                .chargesBlocked(breakdown.charges())
                .exitOrder(exitOrder)
                .executeAfter(now.plus(Duration.ofMillis(executionDelayMs)))
                .createdAt(now)
                .updatedAt(now)
                .build());

        ledgerService.blockMargin(accountId, breakdown.totalCost(),
                "Margin blocked for order #" + order.getId() + " " + order.getOrderSide() + " " + order.getQuantity()
                        + " " + order.getSymbol(), order.getId());
        tradingMetrics.recordOrderPlaced();
        log.info("Order placed orderId={} accountId={} symbol={} side={} qty={} type={} reserved={}",
                order.getId(), accountId, order.getSymbol(), order.getOrderSide(), order.getQuantity(),
                order.getOrderType(), breakdown.totalCost());
        return order;
    }

    public MarginQuoteResponse quoteOrder(Long userId, PlaceOrderRequest request) {
        validate(request);
        TradingAccount account = ledgerService.getAccountForUser(userId);
        Instrument instrument = resolveTradableInstrument(request.getSymbol());
        BigDecimal limitPrice = request.getOrderType() == OrderType.LIMIT ? MoneyUtils.scale(request.getPrice()) : null;
        BigDecimal price = quotePrice(instrument, request.getOrderType(), limitPrice);
        MarginBreakdown breakdown = quote(account.getId(), instrument, request.getOrderSide(), request.getProductType(),
                request.getQuantity(), price);
        BigDecimal available = MoneyUtils.scale(account.getAvailableMargin());
        BigDecimal shortfall = MoneyUtils.max(MoneyUtils.ZERO, MoneyUtils.subtract(breakdown.totalCost(), available));
        return MarginQuoteResponse.builder()
                .symbol(instrument.getSymbol())
                .segment(instrument.getSegment())
                .price(price)
                .lotSize(breakdown.lotSize())
                .orderValue(breakdown.orderValue())
                .leverage(breakdown.leverage())
                .marginRequired(breakdown.marginRequired())
                .brokerage(breakdown.brokerage())
                .stt(breakdown.stt())
                .exchangeFee(breakdown.exchangeFee())
                .gst(breakdown.gst())
                .stampDuty(breakdown.stampDuty())
                .otherCharges(breakdown.otherCharges())
                .totalCost(breakdown.totalCost())
                .availableMargin(available)
                .shortfall(shortfall)
                .sufficient(shortfall.signum() == 0)
                .build();
    }

    /**
     * Margin and charges for a prospective fill, netting off any part of the order that reduces the current
     * open position in the same instrument and product type.
     */
    public MarginBreakdown quote(Long accountId, Instrument instrument, OrderSide side, ProductType productType,
                                 int quantity, BigDecimal price) {
        int openQuantity = positionService.findOpen(accountId, instrument.getId(), productType)
                .map(Position::getQuantity)
                .orElse(0);
        int reducing = PositionMath.reducingQuantity(openQuantity, side, quantity);
        int lotSize = instrument.getLotSize() == null ? 1 : instrument.getLotSize();
        MarginRequest request = new MarginRequest(instrument.getSegment(), productType, quantity, price, lotSize, reducing);
        return marginCalculator.calculate(request,
                riskConfigService.findActive(instrument.getSegment(), productType).orElse(null));
    }

    @Transactional
    public TradeOrder modifyOrder(Long userId, Long orderId, ModifyOrderRequest request) {
        if (request.getQuantity() == null && request.getPrice() == null) {
            throw new BadRequestException("Nothing to modify");
        }
        TradingAccount account = ledgerService.getAccountForUser(userId);
        ledgerService.lockAccount(account.getId());
        TradeOrder order = getOwnedOrder(account.getId(), orderId);
        if (order.getStatus() != OrderStatus.PENDING) {
            throw new ConflictException("Only pending orders can be modified");
        }
        if (request.getPrice() != null && order.getOrderType() == OrderType.MARKET) {
            throw new BadRequestException("Market orders have no price to modify");
        }
        Instrument instrument = resolveTradableInstrument(order.getSymbol());
        int quantity = request.getQuantity() != null ? request.getQuantity() : order.getQuantity();
        BigDecimal limitPrice = order.getOrderType() == OrderType.LIMIT
                ? MoneyUtils.scale(request.getPrice() != null ? request.getPrice() : order.getPrice())
                : null;
        BigDecimal quotePrice = quotePrice(instrument, order.getOrderType(), limitPrice);
        MarginBreakdown breakdown = quote(account.getId(), instrument, order.getOrderSide(), order.getProductType(),
                quantity, quotePrice);

        BigDecimal previous = reservationOf(order, instrument);
        BigDecimal delta = MoneyUtils.subtract(breakdown.totalCost(), previous);
        if (delta.signum() > 0) {
            ledgerService.blockMargin(account.getId(), delta, "Additional margin for modified order #" + orderId, orderId);
        }
        int updated = orderRepository.updatePendingTerms(orderId, quantity, limitPrice, quotePrice,
                breakdown.marginRequired(), breakdown.charges(), LocalDateTime.now());
        if (updated == 0) {
            throw new ConflictException("Order is no longer pending");
        }
        if (delta.signum() < 0) {
            ledgerService.releaseMargin(account.getId(), delta.negate(), "Margin released for modified order #" + orderId,
                    orderId, null);
        }
        log.info("Order modified orderId={} qty={} price={} reservedDelta={}", orderId, quantity, limitPrice, delta);
        return getOwnedOrder(account.getId(), orderId);
    }

    @Transactional
    public CancelOrderResponse cancelOrder(Long userId, Long orderId) {
        TradingAccount account = ledgerService.getAccountForUser(userId);
        ledgerService.lockAccount(account.getId());
        TradeOrder order = getOwnedOrder(account.getId(), orderId);
        return cancel(order, userId, "USER");
    }

    @Transactional
    public CancelOrderResponse cancelOrderAsAdmin(Long adminUserId, Long orderId) {
        Long accountId = orderRepository.findTradingAccountIdById(orderId)
                .orElseThrow(() -> new NotFoundException("Order not found"));
        ledgerService.lockAccount(accountId);
        TradeOrder order = orderRepository.findById(orderId)
                .orElseThrow(() -> new NotFoundException("Order not found"));
        return cancel(order, adminUserId, "ADMIN");
    }

    /**
     * Callers hold the account lock and read {@code order} after taking it, so the reservation released here is
     * the one a concurrent modify last wrote.
     */
    private CancelOrderResponse cancel(TradeOrder order, Long actorId, String actor) {
        int won = orderRepository.transitionStatus(order.getId(), OrderStatus.PENDING, OrderStatus.CANCELLED,
                LocalDateTime.now());
        if (won == 0) {
            OrderStatus current = orderRepository.findById(order.getId()).map(TradeOrder::getStatus).orElse(order.getStatus());
            log.info("Cancel lost race orderId={} status={}", order.getId(), current);
            return CancelOrderResponse.builder()
                    .orderId(order.getId())
                    .cancelled(false)
                    .status(current)
                    .releasedAmount(MoneyUtils.ZERO)
                    .build();
        }
        Instrument instrument = instrumentRepository.findById(order.getInstrumentId()).orElse(null);
        BigDecimal released = reservationOf(order, instrument);
        ledgerService.releaseMargin(order.getTradingAccountId(), released,
                "Margin released for cancelled order #" + order.getId(), order.getId(), null);
        tradingMetrics.recordOrderCancelled();
        log.info("Order transition orderId={} from={} to={} released={} by={}", order.getId(), OrderStatus.PENDING,
                OrderStatus.CANCELLED, released, actor);
        auditEventService.recordEvent(actorId, "order", "CANCELLED", "order", order.getId(),
                "Order cancelled by " + actor, Map.of("released", released.toPlainString()));
        return CancelOrderResponse.builder()
                .orderId(order.getId())
                .cancelled(true)
                .status(OrderStatus.CANCELLED)
                .releasedAmount(released)
                .build();
    }

    /**
     * Amount currently reserved for a PENDING order. Orders created by placement carry it; for rows that do
     * not, it is re-derived at the first available of average price, limit price and last traded price.
     */
    public BigDecimal reservationOf(TradeOrder order, Instrument instrument) {
        BigDecimal stored = order.reservedTotal();
        if (stored != null) {
            return MoneyUtils.scale(stored);
        }
        Optional<BigDecimal> price = priceChain(order, instrument);
        if (price.isEmpty() || instrument == null) {
            log.warn("No price to derive reservation orderId={} symbol={}; releasing nothing", order.getId(),
                    order.getSymbol());
            return MoneyUtils.ZERO;
        }
        int lotSize = instrument.getLotSize() == null ? 1 : instrument.getLotSize();
        MarginBreakdown breakdown = marginCalculator.calculate(
                new MarginRequest(instrument.getSegment(), order.getProductType(), order.getQuantity(), price.get(), lotSize),
                riskConfigService.findActive(instrument.getSegment(), order.getProductType()).orElse(null));
        return breakdown.totalCost();
    }

    /**
     * Fill price for an order: its recorded average price, else its limit price, else the instrument's last
     * traded price.
     */
    public Optional<BigDecimal> priceChain(TradeOrder order, Instrument instrument) {
        if (MoneyUtils.isPositive(order.getAveragePrice())) {
            return Optional.of(MoneyUtils.scale(order.getAveragePrice()));
        }
        if (MoneyUtils.isPositive(order.getPrice())) {
            return Optional.of(MoneyUtils.scale(order.getPrice()));
        }
        if (instrument == null) {
            return Optional.empty();
        }
        return priceFeed.getLastPrice(instrument).map(MoneyUtils::scale);
    }

    public List<TradeOrder> listOrders(Long userId, OrderStatus status) {
        TradingAccount account = ledgerService.getAccountForUser(userId);
        if (status == null) {
            return orderRepository.findByTradingAccountIdOrderByCreatedAtDesc(account.getId());
        }
        return orderRepository.findByTradingAccountIdAndStatusOrderByCreatedAtDesc(account.getId(), status);
    }

    public TradeOrder getOrder(Long userId, Long orderId) {
        TradingAccount account = ledgerService.getAccountForUser(userId);
        return getOwnedOrder(account.getId(), orderId);
    }

    private TradeOrder getOwnedOrder(Long accountId, Long orderId) {
        return orderRepository.findByIdAndTradingAccountId(orderId, accountId)
                .orElseThrow(() -> new NotFoundException("Order not found"));
    }

    private void validate(PlaceOrderRequest request) {
        if (request.getQuantity() == null || request.getQuantity() <= 0) {
            throw new BadRequestException("Quantity must be greater than zero");
        }
        if (request.getOrderType() == OrderType.LIMIT && !MoneyUtils.isPositive(request.getPrice())) {
            throw new BadRequestException("Limit orders require a positive price");
        }
    }

    private Instrument resolveTradableInstrument(String symbol) {
        Instrument instrument = instrumentRepository.findBySymbolIgnoreCase(symbol == null ? "" : symbol.trim())
                .orElseThrow(() -> new InvalidInstrumentException("Unknown instrument " + symbol));
        if (!instrument.isTradable()) {
            throw new InvalidInstrumentException("Instrument " + instrument.getSymbol() + " is not tradable");
        }
        return instrument;
    }

    private BigDecimal quotePrice(Instrument instrument, OrderType orderType, BigDecimal limitPrice) {
        if (orderType == OrderType.LIMIT) {
            return limitPrice;
        }
        return priceFeed.getLastPrice(instrument)
                .map(MoneyUtils::scale)
                .orElseThrow(() -> new BadRequestException("No market price available for " + instrument.getSymbol()));
    }
}
