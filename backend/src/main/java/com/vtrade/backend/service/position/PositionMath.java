package com.vtrade.backend.service.position;

import com.vtrade.backend.model.OrderSide;
import com.vtrade.backend.util.MoneyUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Net-position arithmetic for one fill against a signed open quantity. Covers opening from flat, adding in
 * the same direction, partial reduction, full close and reversal through zero.
 */
public final class PositionMath {

    private PositionMath() {
    }

    /**
     * Quantity of an order that would offset the given open position rather than add exposure.
     */
    public static int reducingQuantity(int openQuantity, OrderSide side, int orderQuantity) {
        if (openQuantity == 0 || Integer.signum(openQuantity) == side.sign()) {
            return 0;
        }
        return Math.min(orderQuantity, Math.abs(openQuantity));
    }

    public static FillResult applyFill(int openQuantity, BigDecimal averagePrice, OrderSide side, int fillQuantity,
                                       BigDecimal fillPrice) {
        if (fillQuantity <= 0) {
            throw new IllegalArgumentException("fill quantity must be positive");
        }
        BigDecimal price = MoneyUtils.scale(fillPrice);
        int signedFill = side.sign() * fillQuantity;

        if (openQuantity == 0) {
            return new FillResult(signedFill, price, 0, fillQuantity, MoneyUtils.ZERO);
        }

        if (Integer.signum(openQuantity) == side.sign()) {
            int newQuantity = openQuantity + signedFill;
            BigDecimal weighted = averagePrice.multiply(BigDecimal.valueOf(Math.abs(openQuantity)))
                    .add(price.multiply(BigDecimal.valueOf(fillQuantity)));
            BigDecimal newAverage = weighted.divide(BigDecimal.valueOf(Math.abs(newQuantity)),
                    MoneyUtils.SCALE, RoundingMode.HALF_UP);
            return new FillResult(newQuantity, newAverage, 0, fillQuantity, MoneyUtils.ZERO);
        }

        int closed = Math.min(fillQuantity, Math.abs(openQuantity));
        BigDecimal realized = realizedPnl(openQuantity, averagePrice, closed, price);
        int remainder = fillQuantity - closed;
        if (remainder == 0) {
            int newQuantity = openQuantity + signedFill;
            return new FillResult(newQuantity, MoneyUtils.scale(averagePrice), closed, 0, realized);
        }
        return new FillResult(side.sign() * remainder, price, closed, remainder, realized);
    }

    /**
     * P&L of closing {@code closedQuantity} units of a position at {@code exitPrice}; the sign of
     * {@code openQuantity} says whether the units were long or short.
     */
    public static BigDecimal realizedPnl(int openQuantity, BigDecimal averagePrice, int closedQuantity,
                                         BigDecimal exitPrice) {
        BigDecimal perUnit = exitPrice.subtract(averagePrice);
        if (openQuantity < 0) {
            perUnit = perUnit.negate();
        }
        return MoneyUtils.scale(perUnit.multiply(BigDecimal.valueOf(closedQuantity)));
    }

    /**
     * @param newQuantity signed quantity after the fill
     * @param closedQuantity units of the prior position closed by the fill
     * @param openedQuantity units of new exposure added in the direction of {@code newQuantity}
     */
    public record FillResult(int newQuantity,
                             BigDecimal newAveragePrice,
                             int closedQuantity,
                             int openedQuantity,
                             BigDecimal realizedPnl) {

        public boolean flipped(int previousQuantity) {
            return previousQuantity != 0 && newQuantity != 0 && Integer.signum(previousQuantity) != Integer.signum(newQuantity);
        }

        public boolean fullyClosed(int previousQuantity) {
            return previousQuantity != 0 && closedQuantity == Math.abs(previousQuantity);
        }
    }
}
