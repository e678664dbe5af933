package com.vtrade.backend.service.risk;

import com.vtrade.backend.config.TradingProperties;
import com.vtrade.backend.model.ProductType;
import com.vtrade.backend.model.RiskConfig;
import com.vtrade.backend.service.risk.MarginCalculator.MarginBreakdown;
import com.vtrade.backend.service.risk.MarginCalculator.MarginRequest;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MarginCalculatorTest {

    private final MarginCalculator calculator = new MarginCalculator(new TradingProperties());

    @Test
    void intradayEquityOrderUsesLeverageAndCappedRateBrokerage() {
        MarginBreakdown breakdown = calculator.calculate(
                new MarginRequest("NSE", ProductType.MIS, 10, new BigDecimal("2500"), 1));

        assertThat(breakdown.orderValue()).isEqualByComparingTo("25000");
        assertThat(breakdown.leverage()).isEqualByComparingTo("200");
        assertThat(breakdown.marginRequired()).isEqualByComparingTo("125");
        assertThat(breakdown.brokerage()).isEqualByComparingTo("7.5");
        assertThat(breakdown.stt()).isEqualByComparingTo("6.25");
        assertThat(breakdown.exchangeFee()).isEqualByComparingTo("0.8125");
        assertThat(breakdown.gst()).isEqualByComparingTo("1.4963");
        assertThat(breakdown.stampDuty()).isEqualByComparingTo("0.75");
        assertThat(breakdown.otherCharges()).isEqualByComparingTo("9.3088");
        assertThat(breakdown.totalCost()).isEqualByComparingTo("141.8088");
        assertThat(breakdown.charges()).isEqualByComparingTo("16.8088");
    }

    @Test
    void brokerageIsCappedForLargeOrders() {
        MarginBreakdown breakdown = calculator.calculate(
                new MarginRequest("nse", ProductType.CNC, 100, new BigDecimal("2500"), 1));

        assertThat(breakdown.leverage()).isEqualByComparingTo("50");
        assertThat(breakdown.marginRequired()).isEqualByComparingTo("5000");
        assertThat(breakdown.brokerage()).isEqualByComparingTo("20");
        assertThat(breakdown.stt()).isEqualByComparingTo("250");
    }

    @Test
    void futuresUseFlatBrokerage() {
        MarginBreakdown breakdown = calculator.calculate(
                new MarginRequest("NFO", ProductType.MIS, 25, new BigDecimal("100"), 25));

        assertThat(breakdown.marginRequired()).isEqualByComparingTo("25");
        assertThat(breakdown.brokerage()).isEqualByComparingTo("20");
        assertThat(breakdown.lotSize()).isEqualTo(25);
    }

    @Test
    void zeroQuantityCostsNothing() {
        MarginBreakdown breakdown = calculator.calculate(
                new MarginRequest("NSE", ProductType.MIS, 0, new BigDecimal("2500"), 1));

        assertThat(breakdown.marginRequired()).isEqualByComparingTo("0");
        assertThat(breakdown.brokerage()).isEqualByComparingTo("0");
        assertThat(breakdown.totalCost()).isEqualByComparingTo("0");
    }

    @Test
    void reducingUnitsNeedNoMarginButStillPayCharges() {
        MarginBreakdown full = calculator.calculate(
                new MarginRequest("NSE", ProductType.MIS, 10, new BigDecimal("2500"), 1, 10));
        MarginBreakdown partial = calculator.calculate(
                new MarginRequest("NSE", ProductType.MIS, 10, new BigDecimal("2500"), 1, 4));

        assertThat(full.marginRequired()).isEqualByComparingTo("0");
        assertThat(full.charges()).isEqualByComparingTo("16.8088");
        assertThat(partial.marginRequired()).isEqualByComparingTo("75");
    }

    @Test
    void activeRiskConfigOverridesLeverageAndBrokerage() {
        RiskConfig override = RiskConfig.builder()
                .segment("NSE")
                .productType(ProductType.MIS)
                .leverage(new BigDecimal("5"))
                .brokerageFlat(new BigDecimal("10"))
                .active(true)
                .build();

        MarginBreakdown breakdown = calculator.calculate(
                new MarginRequest("NSE", ProductType.MIS, 10, new BigDecimal("2500"), 1), override);

        assertThat(breakdown.leverage()).isEqualByComparingTo("5");
        assertThat(breakdown.marginRequired()).isEqualByComparingTo("5000");
        assertThat(breakdown.brokerage()).isEqualByComparingTo("10");
    }

    @Test
    void inactiveRiskConfigIsIgnored() {
        RiskConfig override = RiskConfig.builder()
                .segment("NSE")
                .productType(ProductType.MIS)
                .leverage(new BigDecimal("5"))
                .active(false)
                .build();

        MarginBreakdown breakdown = calculator.calculate(
                new MarginRequest("NSE", ProductType.MIS, 10, new BigDecimal("2500"), 1), override);

        assertThat(breakdown.marginRequired()).isEqualByComparingTo("125");
    }

    @Test
    void unknownSegmentFallsBackToDefaults() {
        MarginBreakdown breakdown = calculator.calculate(
                new MarginRequest("BSE", ProductType.CNC, 2, new BigDecimal("50"), 1));

        assertThat(breakdown.leverage()).isEqualByComparingTo("1");
        assertThat(breakdown.marginRequired()).isEqualByComparingTo("100");
        assertThat(breakdown.brokerage()).isEqualByComparingTo("20");
        assertThat(breakdown.stt()).isEqualByComparingTo("0");
    }

    @Test
    void negativeQuantityIsRejected() {
        assertThatThrownBy(() -> calculator.calculate(
                new MarginRequest("NSE", ProductType.MIS, -1, new BigDecimal("2500"), 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
