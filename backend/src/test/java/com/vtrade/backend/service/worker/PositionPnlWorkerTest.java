package com.vtrade.backend.service.worker;

import com.vtrade.backend.config.WorkerProperties;
import com.vtrade.backend.model.Instrument;
import com.vtrade.backend.model.Position;
import com.vtrade.backend.repository.InstrumentRepository;
import com.vtrade.backend.repository.PositionRepository;
import com.vtrade.backend.service.TradingMetrics;
import com.vtrade.backend.service.marketdata.PriceFeed;
import com.vtrade.backend.service.worker.PositionPnlWorker.Marks;
import com.vtrade.backend.service.worker.PositionPnlWorker.PositionPnlResult;
import com.vtrade.backend.util.MoneyUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PositionPnlWorkerTest {

    private PositionRepository positionRepository;
    private InstrumentRepository instrumentRepository;
    private PriceFeed priceFeed;
    private PositionPnlWorker worker;
    private Instrument instrument;

    @BeforeEach
    void setUp() {
        positionRepository = mock(PositionRepository.class);
        instrumentRepository = mock(InstrumentRepository.class);
        priceFeed = mock(PriceFeed.class);
        worker = new PositionPnlWorker(positionRepository, instrumentRepository, priceFeed,
                mock(WorkerHeartbeatService.class), new WorkerProperties(), mock(TradingMetrics.class));
        instrument = Instrument.builder().id(5L).symbol("RELIANCE").segment("NSE").lotSize(1).tradable(true).build();
        when(instrumentRepository.findAllById(any())).thenReturn(List.of(instrument));
    }

    @Test
    void marksUseSignedQuantity() {
        Position shortPosition = position(1L, -10, "2500", "0", "0");

        Marks marks = PositionPnlWorker.computeMarks(shortPosition, new BigDecimal("2450"), new BigDecimal("2480"));

        assertThat(marks.unrealizedPnl()).isEqualByComparingTo("500");
        assertThat(marks.dayPnl()).isEqualByComparingTo("300");
        assertThat(marks.lastPrice()).isEqualByComparingTo("2450");
    }

    @Test
    void movedPositionIsUpdated() {
        when(positionRepository.findOpenPositions(any(Pageable.class)))
                .thenReturn(List.of(position(1L, 10, "2500", "0", "0")));
        when(priceFeed.getLastPrice(instrument)).thenReturn(Optional.of(new BigDecimal("2510")));
        when(priceFeed.getPreviousClose(instrument)).thenReturn(Optional.of(new BigDecimal("2480")));
        when(positionRepository.updateMarks(eq(1L), any(), any(), any(), any(LocalDateTime.class))).thenReturn(1);

        PositionPnlResult result = worker.processPositionPnl();

        assertThat(result.updated()).isEqualTo(1);
        verify(positionRepository).updateMarks(eq(1L), eq(MoneyUtils.bd("100")), eq(MoneyUtils.bd("300")),
                eq(MoneyUtils.bd("2510")), any(LocalDateTime.class));
    }

    @Test
    void movementBelowThresholdIsSkipped() {
        when(positionRepository.findOpenPositions(any(Pageable.class)))
                .thenReturn(List.of(position(1L, 10, "2500", "100", "300")));
        when(priceFeed.getLastPrice(instrument)).thenReturn(Optional.of(new BigDecimal("2510.05")));
        when(priceFeed.getPreviousClose(instrument)).thenReturn(Optional.of(new BigDecimal("2480")));

        PositionPnlResult result = worker.processPositionPnl();

        assertThat(result.updated()).isZero();
        assertThat(result.skipped()).isEqualTo(1);
        verify(positionRepository, never()).updateMarks(anyLong(), any(), any(), any(), any());
    }

    @Test
    void missingPriceSkipsWithoutWriting() {
        when(positionRepository.findOpenPositions(any(Pageable.class)))
                .thenReturn(List.of(position(1L, 10, "2500", "0", "0")));
        when(priceFeed.getLastPrice(instrument)).thenReturn(Optional.empty());

        PositionPnlResult result = worker.processPositionPnl();

        assertThat(result.skipped()).isEqualTo(1);
        verify(positionRepository, never()).updateMarks(anyLong(), any(), any(), any(), any());
    }

    @Test
    void previousCloseFallsBackToLastPrice() {
        when(positionRepository.findOpenPositions(any(Pageable.class)))
                .thenReturn(List.of(position(1L, 10, "2500", "0", "50")));
        when(priceFeed.getLastPrice(instrument)).thenReturn(Optional.of(new BigDecimal("2520")));
        when(priceFeed.getPreviousClose(instrument)).thenReturn(Optional.empty());
        when(positionRepository.updateMarks(eq(1L), any(), any(), any(), any(LocalDateTime.class))).thenReturn(1);

        worker.processPositionPnl();

        verify(positionRepository).updateMarks(eq(1L), eq(MoneyUtils.bd("200")), eq(MoneyUtils.ZERO),
                eq(MoneyUtils.bd("2520")), any(LocalDateTime.class));
    }

    private Position position(Long id, int quantity, String average, String unrealized, String day) {
        return Position.builder()
                .id(id)
                .instrumentId(instrument == null ? 5L : instrument.getId())
                .symbol("RELIANCE")
                .quantity(quantity)
                .averagePrice(MoneyUtils.bd(average))
                .unrealizedPnl(MoneyUtils.bd(unrealized))
                .dayPnl(MoneyUtils.bd(day))
                .build();
    }
}
