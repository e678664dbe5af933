package com.vtrade.backend.service.position;

import com.vtrade.backend.model.OrderSide;
import com.vtrade.backend.service.position.PositionMath.FillResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class PositionMathTest {

    @Test
    void buyFromFlatOpensLong() {
        FillResult result = PositionMath.applyFill(0, BigDecimal.ZERO, OrderSide.BUY, 10, new BigDecimal("2500"));

        assertThat(result.newQuantity()).isEqualTo(10);
        assertThat(result.newAveragePrice()).isEqualByComparingTo("2500");
        assertThat(result.openedQuantity()).isEqualTo(10);
        assertThat(result.closedQuantity()).isZero();
        assertThat(result.realizedPnl()).isEqualByComparingTo("0");
    }

    @Test
    void sellFromFlatOpensShort() {
        FillResult result = PositionMath.applyFill(0, BigDecimal.ZERO, OrderSide.SELL, 4, new BigDecimal("100"));

        assertThat(result.newQuantity()).isEqualTo(-4);
        assertThat(result.newAveragePrice()).isEqualByComparingTo("100");
    }

    @Test
    void addingToLongWeightsTheAverage() {
        FillResult result = PositionMath.applyFill(10, new BigDecimal("2500"), OrderSide.BUY, 5, new BigDecimal("2600"));

        assertThat(result.newQuantity()).isEqualTo(15);
        assertThat(result.newAveragePrice()).isEqualByComparingTo("2533.3333");
        assertThat(result.realizedPnl()).isEqualByComparingTo("0");
    }

    @Test
    void fullCloseRealizesProfit() {
        FillResult result = PositionMath.applyFill(10, new BigDecimal("2505"), OrderSide.SELL, 10, new BigDecimal("2625"));

        assertThat(result.newQuantity()).isZero();
        assertThat(result.closedQuantity()).isEqualTo(10);
        assertThat(result.realizedPnl()).isEqualByComparingTo("1200");
        assertThat(result.fullyClosed(10)).isTrue();
        assertThat(result.flipped(10)).isFalse();
    }

    @Test
    void partialCloseKeepsAverage() {
        FillResult result = PositionMath.applyFill(10, new BigDecimal("100"), OrderSide.SELL, 4, new BigDecimal("110"));

        assertThat(result.newQuantity()).isEqualTo(6);
        assertThat(result.newAveragePrice()).isEqualByComparingTo("100");
        assertThat(result.realizedPnl()).isEqualByComparingTo("40");
        assertThat(result.fullyClosed(10)).isFalse();
    }

    @Test
    void coveringShortBelowEntryIsProfit() {
        FillResult result = PositionMath.applyFill(-10, new BigDecimal("100"), OrderSide.BUY, 10, new BigDecimal("80"));

        assertThat(result.newQuantity()).isZero();
        assertThat(result.realizedPnl()).isEqualByComparingTo("200");
    }

    @Test
    void oversizedOppositeFillFlipsAtFillPrice() {
        FillResult result = PositionMath.applyFill(10, new BigDecimal("100"), OrderSide.SELL, 15, new BigDecimal("90"));

        assertThat(result.closedQuantity()).isEqualTo(10);
        assertThat(result.openedQuantity()).isEqualTo(5);
        assertThat(result.newQuantity()).isEqualTo(-5);
        assertThat(result.newAveragePrice()).isEqualByComparingTo("90");
        assertThat(result.realizedPnl()).isEqualByComparingTo("-100");
        assertThat(result.flipped(10)).isTrue();
        assertThat(result.fullyClosed(10)).isTrue();
    }

    @Test
    void reducingQuantityOnlyCountsOppositeSide() {
        assertThat(PositionMath.reducingQuantity(0, OrderSide.SELL, 5)).isZero();
        assertThat(PositionMath.reducingQuantity(10, OrderSide.BUY, 5)).isZero();
        assertThat(PositionMath.reducingQuantity(10, OrderSide.SELL, 5)).isEqualTo(5);
        assertThat(PositionMath.reducingQuantity(10, OrderSide.SELL, 15)).isEqualTo(10);
        assertThat(PositionMath.reducingQuantity(-3, OrderSide.BUY, 5)).isEqualTo(3);
    }
}
