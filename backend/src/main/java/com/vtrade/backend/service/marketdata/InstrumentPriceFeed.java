package com.vtrade.backend.service.marketdata;

import com.vtrade.backend.model.Instrument;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Prices from the instruments table, which the market-data ingestion process keeps current.
 */
@Component
public class InstrumentPriceFeed implements PriceFeed {

    @Override
    public Optional<BigDecimal> getLastPrice(Instrument instrument) {
        return positive(instrument == null ? null : instrument.getLastTradedPrice());
    }

    @Override
    public Optional<BigDecimal> getPreviousClose(Instrument instrument) {
        return positive(instrument == null ? null : instrument.getPreviousClose());
    }

    private Optional<BigDecimal> positive(BigDecimal value) {
        return value != null && value.signum() > 0 ? Optional.of(value) : Optional.empty();
    }
}
