package com.vtrade.backend.service.marketdata;

import com.vtrade.backend.model.Instrument;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Read-only view of live prices. Implementations return empty when no usable price is known; callers never
 * substitute a made-up value.
 */
public interface PriceFeed {

    Optional<BigDecimal> getLastPrice(Instrument instrument);

    Optional<BigDecimal> getPreviousClose(Instrument instrument);
}
