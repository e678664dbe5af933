package com.vtrade.backend.service.risk;

import com.vtrade.backend.IntegrationTestSupport;
import com.vtrade.backend.dto.RiskConfigRequest;
import com.vtrade.backend.model.OrderSide;
import com.vtrade.backend.model.ProductType;
import com.vtrade.backend.model.RiskConfig;
import com.vtrade.backend.model.TradeOrder;
import com.vtrade.backend.service.order.OrderService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class RiskConfigServiceTest extends IntegrationTestSupport {

    private static final Long ADMIN_ID = 1L;
    private static final Long USER_ID = 81L;

    @Autowired
    private RiskConfigService riskConfigService;

    @Autowired
    private OrderService orderService;

    @BeforeEach
    void setUp() {
        fundedAccount(USER_ID, "100000");
        instrument("RELIANCE", "NSE", "2500", "2480");
    }

    @Test
    void activeOverrideDrivesPlacementMargin() {
        RiskConfig saved = riskConfigService.upsert(ADMIN_ID, RiskConfigRequest.builder()
                .segment("nse")
                .productType(ProductType.MIS)
                .leverage(new BigDecimal("100"))
                .build());

        assertThat(saved.getSegment()).isEqualTo("NSE");
        assertThat(riskConfigService.findActive("NSE", ProductType.MIS)).isPresent();
        TradeOrder order = orderService.placeOrder(USER_ID, market("RELIANCE", OrderSide.BUY, 10));
        assertThat(order.getMarginBlocked()).isEqualByComparingTo("250");
    }

    @Test
    void upsertUpdatesExistingRowAndDeactivateFallsBackToDefaults() {
        RiskConfig first = riskConfigService.upsert(ADMIN_ID, RiskConfigRequest.builder()
                .segment("NSE").productType(ProductType.MIS).leverage(new BigDecimal("100")).build());
        RiskConfig second = riskConfigService.upsert(ADMIN_ID, RiskConfigRequest.builder()
                .segment("NSE").productType(ProductType.MIS).leverage(new BigDecimal("50")).build());

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(riskConfigService.list()).hasSize(1);

        riskConfigService.deactivate(ADMIN_ID, first.getId());

        assertThat(riskConfigService.findActive("NSE", ProductType.MIS)).isEmpty();
        TradeOrder order = orderService.placeOrder(USER_ID, market("RELIANCE", OrderSide.BUY, 10));
        assertThat(order.getMarginBlocked()).isEqualByComparingTo("125");
    }
}
