package com.vtrade.backend.controller;

import com.vtrade.backend.IntegrationTestSupport;
import com.vtrade.backend.model.OrderSide;
import com.vtrade.backend.model.Position;
import com.vtrade.backend.model.TradeOrder;
import com.vtrade.backend.security.JwtTokenProvider;
import com.vtrade.backend.service.order.OrderExecutionService;
import com.vtrade.backend.service.order.OrderService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ApiSecurityIntegrationTest extends IntegrationTestSupport {

    private static final Long USER_ID = 71L;
    private static final Long ADMIN_ID = 1L;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    @Autowired
    private OrderService orderService;

    @Autowired
    private OrderExecutionService orderExecutionService;

    private String userToken;
    private String adminToken;

    @BeforeEach
    void setUp() {
        fundedAccount(USER_ID, "100000");
        instrument("RELIANCE", "NSE", "2500", "2480");
        userToken = "Bearer " + jwtTokenProvider.generateToken("trader", USER_ID, "USER");
        adminToken = "Bearer " + jwtTokenProvider.generateToken("admin", ADMIN_ID, "ADMIN");
    }

    @Test
    void requestWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/orders"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("UNAUTHORIZED"));
    }

    @Test
    void adminRoutesNeedAdminRole() throws Exception {
        mockMvc.perform(get("/api/admin/workers").header("Authorization", userToken))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("FORBIDDEN"));
        mockMvc.perform(get("/api/admin/workers").header("Authorization", adminToken))
                .andExpect(status().isOk());
    }

    @Test
    void placeOrderOverHttp() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .header("Authorization", userToken)
                        .header("X-Request-Id", "req-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":"RELIANCE","quantity":10,"orderType":"MARKET","orderSide":"BUY","productType":"MIS"}
                                """))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "req-1"))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.symbol").value("RELIANCE"));

        mockMvc.perform(get("/api/account").header("Authorization", userToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pendingOrders").value(1));
    }

    @Test
    void failuresMapToErrorCodes() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .header("Authorization", userToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":"RELIANCE","quantity":100000,"orderType":"MARKET","orderSide":"BUY","productType":"MIS"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("INSUFFICIENT_MARGIN"));

        mockMvc.perform(post("/api/orders")
                        .header("Authorization", userToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":"UNKNOWN","quantity":1,"orderType":"MARKET","orderSide":"BUY","productType":"MIS"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("INVALID_INSTRUMENT"));

        mockMvc.perform(post("/api/orders")
                        .header("Authorization", userToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":"RELIANCE","quantity":0,"orderType":"MARKET","orderSide":"BUY","productType":"MIS"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        assertThat(orderRepository.count()).isZero();
    }

    @Test
    void apiDocsArePublic() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.securitySchemes.bearerAuth.bearerFormat").value("JWT"))
                .andExpect(jsonPath("$.tags[*].name", hasItems("Orders", "Positions", "Account", "Admin")));
    }

    @Test
    void riskMonitorPassIsAdminOnly() throws Exception {
        mockMvc.perform(post("/api/admin/risk/monitor").header("Authorization", userToken))
                .andExpect(status().isForbidden());
        mockMvc.perform(post("/api/admin/risk/monitor").header("Authorization", adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.errors").value(0));
        mockMvc.perform(get("/api/admin/risk/alerts").header("Authorization", adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void adminPatchWithExplicitNullClearsStopLoss() throws Exception {
        TradeOrder buy = orderService.placeOrder(USER_ID, market("RELIANCE", OrderSide.BUY, 10));
        Long positionId = orderExecutionService.execute(buy.getId()).positionId();
        Position position = positionRepository.findById(positionId).orElseThrow();
        position.setStopLoss(new BigDecimal("2400"));
        position.setTarget(new BigDecimal("2700"));
        positionRepository.save(position);

        mockMvc.perform(patch("/api/admin/positions/" + positionId)
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stopLoss\": null}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.position.stopLoss").value(nullValue()))
                .andExpect(jsonPath("$.summary.fundsAdjusted").value(false));

        Position updated = positionRepository.findById(positionId).orElseThrow();
        assertThat(updated.getStopLoss()).isNull();
        assertThat(updated.getTarget()).isEqualByComparingTo("2700");
    }

    @Test
    void listAndCloseOwnPosition() throws Exception {
        TradeOrder buy = orderService.placeOrder(USER_ID, market("RELIANCE", OrderSide.BUY, 10));
        Long positionId = orderExecutionService.execute(buy.getId()).positionId();

        mockMvc.perform(get("/api/positions").header("Authorization", userToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(positionId))
                .andExpect(jsonPath("$[0].quantity").value(10))
                .andExpect(jsonPath("$[0].open").value(true));

        mockMvc.perform(post("/api/positions/" + positionId + "/close").header("Authorization", userToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.exitOrderStatus").value("EXECUTED"))
                .andExpect(jsonPath("$.remainingQuantity").value(0));

        mockMvc.perform(get("/api/positions").header("Authorization", userToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
        assertLedgerConsistent(reload(accountRepository.findByUserId(USER_ID).orElseThrow()));
    }

    @Test
    void anotherUsersPositionIsNotFound() throws Exception {
        TradeOrder buy = orderService.placeOrder(USER_ID, market("RELIANCE", OrderSide.BUY, 10));
        Long positionId = orderExecutionService.execute(buy.getId()).positionId();
        fundedAccount(72L, "1000");
        String otherToken = "Bearer " + jwtTokenProvider.generateToken("other", 72L, "USER");

        mockMvc.perform(post("/api/positions/" + positionId + "/close").header("Authorization", otherToken))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }
}
