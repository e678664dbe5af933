package com.vtrade.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "instruments")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Instrument {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String symbol;

    private String name;
    private String exchange;

    @Column(nullable = false, length = 16)
    private String segment;

    @Column(name = "lot_size", nullable = false)
    private Integer lotSize;

    @Column(nullable = false)
    private boolean tradable;

    @Column(name = "last_traded_price", precision = 19, scale = 4)
    private BigDecimal lastTradedPrice;

    @Column(name = "previous_close", precision = 19, scale = 4)
    private BigDecimal previousClose;

    @Column(name = "price_updated_at")
    private LocalDateTime priceUpdatedAt;
}
