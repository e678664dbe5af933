package com.vtrade.backend.service.risk;

import com.vtrade.backend.config.TradingProperties;
import com.vtrade.backend.model.ProductType;
import com.vtrade.backend.model.RiskConfig;
import com.vtrade.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Locale;
import java.util.Map;

/**
 * Margin and charges for a prospective fill. Deterministic: the same inputs always give the same breakdown,
 * so the pre-trade quote and the amount reserved at placement agree.
 */
@Component
@RequiredArgsConstructor
public class MarginCalculator {

    private static final MathContext MC = MathContext.DECIMAL64;

    private final TradingProperties tradingProperties;

    public MarginBreakdown calculate(MarginRequest request) {
        return calculate(request, null);
    }

    /**
     * @param override active risk config row for the segment and product type, or null to use the configured
     *                 defaults
     */
    public MarginBreakdown calculate(MarginRequest request, RiskConfig override) {
        if (request.quantity() < 0) {
            throw new IllegalArgumentException("quantity must not be negative");
        }
        if (request.price() == null || request.price().signum() < 0) {
            throw new IllegalArgumentException("price must not be negative");
        }
        String segment = normalize(request.segment());
        BigDecimal price = request.price();
        BigDecimal orderValue = price.multiply(BigDecimal.valueOf(request.quantity()), MC);

        int reducing = Math.min(Math.max(request.reducingQuantity(), 0), request.quantity());
        int increasing = request.quantity() - reducing;
        BigDecimal leverage = resolveLeverage(segment, request.productType(), override);
        BigDecimal marginValue = price.multiply(BigDecimal.valueOf(increasing), MC);
        BigDecimal margin = MoneyUtils.scale(marginValue.divide(leverage, MC));

        BigDecimal brokerage = MoneyUtils.scale(brokerage(segment, orderValue, override));
        TradingProperties.Charges charges = tradingProperties.getCharges();
        BigDecimal stt = orderValue.multiply(sttRate(segment, request.productType()), MC);
        BigDecimal exchangeFee = orderValue.multiply(charges.getExchangeFeeRate(), MC);
        BigDecimal gst = brokerage.add(exchangeFee).multiply(charges.getGstRate(), MC);
        BigDecimal stampDuty = orderValue.multiply(charges.getStampDutyRate(), MC);
        BigDecimal otherCharges = MoneyUtils.scale(stt.add(exchangeFee).add(gst).add(stampDuty));

        return new MarginBreakdown(
                MoneyUtils.scale(orderValue),
                leverage,
                margin,
                brokerage,
                MoneyUtils.scale(stt),
                MoneyUtils.scale(exchangeFee),
                MoneyUtils.scale(gst),
                MoneyUtils.scale(stampDuty),
                otherCharges,
                margin.add(brokerage).add(otherCharges),
                request.lotSize()
        );
    }

    BigDecimal resolveLeverage(String segment, ProductType productType, RiskConfig override) {
        if (override != null && override.isActive() && MoneyUtils.isPositive(override.getLeverage())) {
            return override.getLeverage();
        }
        Map<ProductType, BigDecimal> bySegment = tradingProperties.getMargin().getLeverage().get(segment);
        if (bySegment != null && bySegment.get(productType) != null) {
            return bySegment.get(productType);
        }
        return tradingProperties.getMargin().getDefaultLeverage();
    }

    private BigDecimal brokerage(String segment, BigDecimal orderValue, RiskConfig override) {
        if (override != null && override.isActive()
                && (override.getBrokerageFlat() != null || override.getBrokerageRate() != null)) {
            return applyBrokerage(override.getBrokerageFlat(), override.getBrokerageRate(), override.getBrokerageCap(), orderValue);
        }
        TradingProperties.Brokerage rule = tradingProperties.getCharges().getBrokerage()
                .getOrDefault(segment, tradingProperties.getCharges().getDefaultBrokerage());
        return applyBrokerage(rule.getFlat(), rule.getRate(), rule.getCap(), orderValue);
    }

    private BigDecimal applyBrokerage(BigDecimal flat, BigDecimal rate, BigDecimal cap, BigDecimal orderValue) {
        if (orderValue.signum() == 0) {
            return BigDecimal.ZERO;
        }
        if (flat != null) {
            return flat;
        }
        if (rate == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal variable = orderValue.multiply(rate, MC);
        return cap == null ? variable : variable.min(cap);
    }

    private BigDecimal sttRate(String segment, ProductType productType) {
        Map<ProductType, BigDecimal> bySegment = tradingProperties.getCharges().getStt().get(segment);
        if (bySegment == null) {
            return BigDecimal.ZERO;
        }
        return bySegment.getOrDefault(productType, BigDecimal.ZERO);
    }

    static String normalize(String segment) {
        return segment == null ? "" : segment.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * @param reducingQuantity part of {@code quantity} that offsets an existing opposite position and so needs
     *                         no new margin
     */
    public record MarginRequest(String segment,
                                ProductType productType,
                                int quantity,
                                BigDecimal price,
                                int lotSize,
                                int reducingQuantity) {

        public MarginRequest(String segment, ProductType productType, int quantity, BigDecimal price, int lotSize) {
            this(segment, productType, quantity, price, lotSize, 0);
        }
    }

    public record MarginBreakdown(BigDecimal orderValue,
                                  BigDecimal leverage,
                                  BigDecimal marginRequired,
                                  BigDecimal brokerage,
                                  BigDecimal stt,
                                  BigDecimal exchangeFee,
                                  BigDecimal gst,
                                  BigDecimal stampDuty,
                                  BigDecimal otherCharges,
                                  BigDecimal totalCost,
                                  int lotSize) {

        public BigDecimal charges() {
            return brokerage.add(otherCharges);
        }
    }
}
