package com.vtrade.backend.service.position;

import com.vtrade.backend.dto.UpdateProtectionRequest;
import com.vtrade.backend.exception.ConflictException;
import com.vtrade.backend.exception.NotFoundException;
import com.vtrade.backend.model.Instrument;
import com.vtrade.backend.model.Position;
import com.vtrade.backend.model.ProductType;
import com.vtrade.backend.model.TradeOrder;
import com.vtrade.backend.repository.PositionRepository;
import com.vtrade.backend.service.ledger.LedgerService;
import com.vtrade.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class PositionService {

    private final PositionRepository positionRepository;
    private final LedgerService ledgerService;

    public Optional<Position> findOpen(Long accountId, Long instrumentId, ProductType productType) {
        return positionRepository.findOpen(accountId, instrumentId, productType);
    }

    public List<Position> listPositions(Long accountId, boolean openOnly) {
        if (openOnly) {
            return positionRepository.findByTradingAccountIdAndQuantityNotOrderByOpenedAtDesc(accountId, 0);
        }
        return positionRepository.findByTradingAccountIdOrderByOpenedAtDesc(accountId);
    }

    public Position getPosition(Long accountId, Long positionId) {
        return positionRepository.findByIdAndTradingAccountId(positionId, accountId)
                .orElseThrow(() -> new NotFoundException("Position not found"));
    }

    public Position getPosition(Long positionId) {
        return positionRepository.findById(positionId)
                .orElseThrow(() -> new NotFoundException("Position not found"));
    }

    /**
     * Works out what a fill of {@code order} at {@code fillPrice} does to the current open position. Callers
     * must hold the account lock between planning and {@link #settleFill}.
     */
    public FillPlan planFill(TradeOrder order, BigDecimal fillPrice) {
        Optional<Position> open = positionRepository.findOpen(order.getTradingAccountId(), order.getInstrumentId(),
                order.getProductType());
        int openQuantity = open.map(Position::getQuantity).orElse(0);
        BigDecimal average = open.map(Position::getAveragePrice).orElse(MoneyUtils.ZERO);
        PositionMath.FillResult result = PositionMath.applyFill(openQuantity, average, order.getOrderSide(),
                order.getQuantity(), fillPrice);
        return new FillPlan(open.orElse(null), openQuantity, result, MoneyUtils.scale(fillPrice));
    }

    /**
     * Applies a planned fill: releases margin held for the closed units, books realized P&L, and updates or
     * opens the position row. {@code openingMargin} is the margin already moved into usedMargin for the
     * opened units and becomes part of the position's blocked margin.
     */
    @Transactional
    public Settlement settleFill(TradeOrder order, Instrument instrument, FillPlan plan, BigDecimal openingMargin) {
        PositionMath.FillResult result = plan.result();
        Position existing = plan.position();
        LocalDateTime now = LocalDateTime.now();
        BigDecimal marginReleased = MoneyUtils.ZERO;
        Long closedPositionId = null;
        Position holding = existing;

        if (existing != null && result.closedQuantity() > 0) {
            int previous = plan.previousQuantity();
            boolean fullClose = result.fullyClosed(previous);
            marginReleased = fullClose
                    ? MoneyUtils.scale(existing.getBlockedMargin())
                    : MoneyUtils.scale(existing.getBlockedMargin()
                            .multiply(BigDecimal.valueOf(result.closedQuantity()))
                            .divide(BigDecimal.valueOf(Math.abs(previous)), MoneyUtils.SCALE, RoundingMode.HALF_UP));
            ledgerService.releaseMargin(order.getTradingAccountId(), marginReleased,
                    "Margin released on " + result.closedQuantity() + " " + order.getSymbol(), order.getId(), existing.getId());
            ledgerService.applyRealizedPnl(order.getTradingAccountId(), result.realizedPnl(),
                    "Realized P&L " + order.getSymbol() + " qty " + result.closedQuantity(), order.getId(), existing.getId());

            existing.setRealizedPnl(MoneyUtils.add(existing.getRealizedPnl(), result.realizedPnl()));
            existing.setLastPrice(plan.fillPrice());
            if (fullClose) {
                existing.setQuantity(0);
                existing.setBlockedMargin(MoneyUtils.ZERO);
                existing.setStopLoss(null);
                existing.setTarget(null);
                existing.setUnrealizedPnl(MoneyUtils.ZERO);
                existing.setDayPnl(MoneyUtils.ZERO);
                existing.setClosedAt(now);
                closedPositionId = existing.getId();
            } else {
                existing.setQuantity(result.newQuantity());
                existing.setBlockedMargin(MoneyUtils.subtract(existing.getBlockedMargin(), marginReleased));
            }
            existing = positionRepository.save(existing);
            holding = existing;
            log.info("Position reduced positionId={} closedQty={} realizedPnl={} remainingQty={}",
                    existing.getId(), result.closedQuantity(), result.realizedPnl(), existing.getQuantity());
        }

        if (result.openedQuantity() > 0) {
            if (existing != null && existing.isOpen()) {
                existing.setQuantity(result.newQuantity());
                existing.setAveragePrice(result.newAveragePrice());
                existing.setBlockedMargin(MoneyUtils.add(existing.getBlockedMargin(), openingMargin));
                existing.setLastPrice(plan.fillPrice());
                holding = positionRepository.save(existing);
                log.info("Position increased positionId={} qty={} avg={}", holding.getId(), holding.getQuantity(),
                        holding.getAveragePrice());
            } else {
                holding = positionRepository.save(Position.builder()
                        .tradingAccountId(order.getTradingAccountId())
                        .instrumentId(order.getInstrumentId())
                        .symbol(order.getSymbol())
                        .productType(order.getProductType())
                        .segment(instrument == null ? null : instrument.getSegment())
                        .quantity(result.newQuantity())
                        .averagePrice(result.newAveragePrice())
                        .blockedMargin(MoneyUtils.scale(openingMargin))
                        .unrealizedPnl(MoneyUtils.ZERO)
                        .dayPnl(MoneyUtils.ZERO)
                        .realizedPnl(MoneyUtils.ZERO)
                        .lastPrice(plan.fillPrice())
                        .openedAt(now)
                        .build());
                log.info("Position opened positionId={} symbol={} qty={} avg={}", holding.getId(), holding.getSymbol(),
                        holding.getQuantity(), holding.getAveragePrice());
            }
        }

        return new Settlement(holding == null ? null : holding.getId(), closedPositionId, result.realizedPnl(),
                marginReleased, result);
    }

    @Transactional
    public Position updateProtection(Long accountId, Long positionId, UpdateProtectionRequest request) {
        Position position = getPosition(accountId, positionId);
        if (!position.isOpen()) {
            throw new ConflictException("Position is closed");
        }
        position.setStopLoss(request.getStopLoss() == null ? null : MoneyUtils.scale(request.getStopLoss()));
        position.setTarget(request.getTarget() == null ? null : MoneyUtils.scale(request.getTarget()));
        log.info("Position protection updated positionId={} stopLoss={} target={}", positionId,
                position.getStopLoss(), position.getTarget());
        return positionRepository.save(position);
    }

    /**
     * @param position open position before the fill, or null when flat
     * @param previousQuantity signed quantity before the fill
     */
    public record FillPlan(Position position, int previousQuantity, PositionMath.FillResult result, BigDecimal fillPrice) {

        public int closingQuantity() {
            return result.closedQuantity();
        }
    }

    /**
     * @param positionId row holding the exposure after the fill (the closed row on a plain full close)
     * @param closedPositionId row closed by this fill, if any
     */
    public record Settlement(Long positionId,
                             Long closedPositionId,
                             BigDecimal realizedPnl,
                             BigDecimal marginReleased,
                             PositionMath.FillResult result) {
    }
}
