package com.vtrade.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "vtrade.workers")
@Data
@Validated
public class WorkerProperties {

    @Valid
    private OrderExecution orderExecution = new OrderExecution();

    @Valid
    private PositionPnl positionPnl = new PositionPnl();

    @Valid
    private RiskMonitor riskMonitor = new RiskMonitor();

    @Data
    public static class OrderExecution {
        private boolean enabled = false;

        @Min(100)
        private long intervalMs = 750;

        // Clamped to 1..200 at use
        private int batchLimit = 50;

        private String workerId = "order-execution";
    }

    @Data
    public static class PositionPnl {
        private boolean enabled = false;

        @Min(100)
        private long intervalMs = 3000;

        // Clamped to 1..2000 at use
        private int batchLimit = 500;

        /** Minimum change in unrealized or day P&L that triggers a write. */
        @NotNull
        @DecimalMin("0")
        private BigDecimal updateThreshold = BigDecimal.ONE;

        private String workerId = "position-pnl";
    }

    @Data
    public static class RiskMonitor {
        private boolean enabled = false;

        @Min(1000)
        private long intervalMs = 15000;

        // Accounts per pass, clamped to 1..1000 at use
        private int batchLimit = 200;

        /** Share of balance plus available margin that unrealized loss may reach before a warning alert. */
        @NotNull
        @DecimalMin("0")
        @DecimalMax("1")
        private BigDecimal warningThreshold = new BigDecimal("0.80");

        /** Share at which losing positions are squared off, worst first. */
        @NotNull
        @DecimalMin("0")
        @DecimalMax("1")
        private BigDecimal autoCloseThreshold = new BigDecimal("0.90");

        private String workerId = "risk-monitor";
    }
}
