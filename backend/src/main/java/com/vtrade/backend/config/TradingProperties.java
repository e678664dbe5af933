package com.vtrade.backend.config;

import com.vtrade.backend.model.ProductType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "vtrade.trading")
@Data
@Validated
public class TradingProperties {

    @Valid
    private Orders orders = new Orders();

    @Valid
    private Margin margin = new Margin();

    @Valid
    private Charges charges = new Charges();

    @Data
    public static class Orders {

        /** Simulated venue latency between placement and earliest execution. */
        @Min(0)
        private long executionDelayMs = 3000;

        /** Execute exit orders in the close request instead of waiting for the worker. */
        private boolean closeFastPath = true;
    }

    @Data
    public static class Margin {

        @NotNull
        @DecimalMin("1")
        private BigDecimal defaultLeverage = BigDecimal.ONE;

        /** segment -> product type -> leverage, used when no active risk config row exists. */
        private Map<String, Map<ProductType, BigDecimal>> leverage = defaultLeverageTable();

        private static Map<String, Map<ProductType, BigDecimal>> defaultLeverageTable() {
            Map<String, Map<ProductType, BigDecimal>> table = new HashMap<>();
            table.put("NSE", new HashMap<>(Map.of(ProductType.MIS, BigDecimal.valueOf(200), ProductType.CNC, BigDecimal.valueOf(50))));
            table.put("NFO", new HashMap<>(Map.of(ProductType.MIS, BigDecimal.valueOf(100), ProductType.CNC, BigDecimal.valueOf(100))));
            table.put("MCX", new HashMap<>(Map.of(ProductType.MIS, BigDecimal.valueOf(50), ProductType.CNC, BigDecimal.valueOf(50))));
            return table;
        }
    }

    @Data
    public static class Charges {

        /** Brokerage rule per segment; segments not listed use {@link #defaultBrokerage}. */
        @Valid
        private Map<String, Brokerage> brokerage = defaultBrokerageTable();

        @Valid
        private Brokerage defaultBrokerage = Brokerage.flat(new BigDecimal("20"));

        /** Securities transaction tax: segment -> product type -> rate on order value. */
        private Map<String, Map<ProductType, BigDecimal>> stt = defaultSttTable();

        @NotNull
        @DecimalMin("0")
        private BigDecimal exchangeFeeRate = new BigDecimal("0.0000325");

        /** Applied to brokerage plus exchange fee. */
        @NotNull
        @DecimalMin("0")
        private BigDecimal gstRate = new BigDecimal("0.18");

        @NotNull
        @DecimalMin("0")
        private BigDecimal stampDutyRate = new BigDecimal("0.00003");

        private static Map<String, Brokerage> defaultBrokerageTable() {
            Map<String, Brokerage> table = new HashMap<>();
            Brokerage equity = new Brokerage();
            equity.setRate(new BigDecimal("0.0003"));
            equity.setCap(new BigDecimal("20"));
            table.put("NSE", equity);
            table.put("NFO", Brokerage.flat(new BigDecimal("20")));
            return table;
        }

        private static Map<String, Map<ProductType, BigDecimal>> defaultSttTable() {
            Map<String, Map<ProductType, BigDecimal>> table = new HashMap<>();
            table.put("NSE", new HashMap<>(Map.of(ProductType.CNC, new BigDecimal("0.001"), ProductType.MIS, new BigDecimal("0.00025"))));
            table.put("NFO", new HashMap<>(Map.of(ProductType.CNC, new BigDecimal("0.0001"), ProductType.MIS, new BigDecimal("0.0001"))));
            return table;
        }
    }

    /**
     * Either a flat fee per order, or a rate on order value optionally capped.
     */
    @Data
    public static class Brokerage {

        @DecimalMin("0")
        private BigDecimal flat;

        @DecimalMin("0")
        private BigDecimal rate;

        @DecimalMin("0")
        private BigDecimal cap;

        public static Brokerage flat(BigDecimal amount) {
            Brokerage brokerage = new Brokerage();
            brokerage.setFlat(amount);
            return brokerage;
        }
    }
}
