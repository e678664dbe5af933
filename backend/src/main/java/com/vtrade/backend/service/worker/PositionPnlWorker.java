package com.vtrade.backend.service.worker;

import com.vtrade.backend.config.WorkerProperties;
import com.vtrade.backend.model.Instrument;
import com.vtrade.backend.model.Position;
import com.vtrade.backend.repository.InstrumentRepository;
import com.vtrade.backend.repository.PositionRepository;
import com.vtrade.backend.service.TradingMetrics;
import com.vtrade.backend.service.marketdata.PriceFeed;
import com.vtrade.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Marks open positions to market. Writes are limited to the unrealized P&L, day P&L and last price columns
 * and are skipped when neither P&L moved by at least the configured threshold. Positions without a live
 * price are left untouched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PositionPnlWorker {

    static final int MAX_BATCH = 2000;

    private final PositionRepository positionRepository;
    private final InstrumentRepository instrumentRepository;
    private final PriceFeed priceFeed;
    private final WorkerHeartbeatService heartbeatService;
    private final WorkerProperties workerProperties;
    private final TradingMetrics tradingMetrics;

    public PositionPnlResult processPositionPnl() {
        return processPositionPnl(workerProperties.getPositionPnl().getBatchLimit());
    }

    public PositionPnlResult processPositionPnl(int limit) {
        long started = System.currentTimeMillis();
        BigDecimal threshold = workerProperties.getPositionPnl().getUpdateThreshold();
        List<Position> open = positionRepository.findOpenPositions(PageRequest.of(0, clamp(limit)));
        Map<Long, Instrument> instruments = loadInstruments(open);
        int updated = 0;
        int skipped = 0;
        int errors = 0;

        for (Position position : open) {
            try {
                Instrument instrument = instruments.get(position.getInstrumentId());
                Optional<BigDecimal> price = priceFeed.getLastPrice(instrument);
                if (price.isEmpty()) {
                    skipped++;
                    continue;
                }
                Marks marks = computeMarks(position, price.get(), priceFeed.getPreviousClose(instrument).orElse(price.get()));
                if (!movedEnough(position, marks, threshold)) {
                    skipped++;
                    continue;
                }
                int rows = positionRepository.updateMarks(position.getId(), marks.unrealizedPnl(), marks.dayPnl(),
                        marks.lastPrice(), LocalDateTime.now());
                if (rows == 1) {
                    updated++;
                } else {
                    skipped++;
                }
            } catch (Exception e) {
                errors++;
                log.error("Mark-to-market failed positionId={}", position.getId(), e);
            }
        }

        long elapsed = System.currentTimeMillis() - started;
        tradingMetrics.recordPositionMarks(updated);
        heartbeatService.beat(workerProperties.getPositionPnl().getWorkerId(), open.size(), updated, skipped, errors,
                elapsed);
        log.debug("Position P&L pass scanned={} updated={} skipped={} errors={} elapsedMs={}",
                open.size(), updated, skipped, errors, elapsed);
        return new PositionPnlResult(open.size(), updated, skipped, errors, elapsed);
    }

    /**
     * Signed quantity makes the same formula hold for longs and shorts.
     */
    static Marks computeMarks(Position position, BigDecimal price, BigDecimal previousClose) {
        BigDecimal quantity = BigDecimal.valueOf(position.getQuantity());
        BigDecimal unrealized = MoneyUtils.scale(price.subtract(position.getAveragePrice()).multiply(quantity));
        BigDecimal day = MoneyUtils.scale(price.subtract(previousClose).multiply(quantity));
        return new Marks(unrealized, day, MoneyUtils.scale(price));
    }

    private boolean movedEnough(Position position, Marks marks, BigDecimal threshold) {
        BigDecimal unrealizedMove = marks.unrealizedPnl().subtract(MoneyUtils.scale(position.getUnrealizedPnl())).abs();
        BigDecimal dayMove = marks.dayPnl().subtract(MoneyUtils.scale(position.getDayPnl())).abs();
        return unrealizedMove.compareTo(threshold) >= 0 || dayMove.compareTo(threshold) >= 0;
    }

    private Map<Long, Instrument> loadInstruments(List<Position> positions) {
        Set<Long> ids = positions.stream().map(Position::getInstrumentId).collect(Collectors.toSet());
        Map<Long, Instrument> byId = new HashMap<>();
        instrumentRepository.findAllById(ids).forEach(instrument -> byId.put(instrument.getId(), instrument));
        return byId;
    }

    static int clamp(int limit) {
        return Math.max(1, Math.min(MAX_BATCH, limit));
    }

    record Marks(BigDecimal unrealizedPnl, BigDecimal dayPnl, BigDecimal lastPrice) {
    }

    public record PositionPnlResult(int scanned, int updated, int skipped, int errors, long elapsedMs) {
    }
}
