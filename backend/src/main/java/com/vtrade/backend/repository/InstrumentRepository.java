package com.vtrade.backend.repository;

import com.vtrade.backend.model.Instrument;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface InstrumentRepository extends JpaRepository<Instrument, Long> {
    Optional<Instrument> findBySymbolIgnoreCase(String symbol);
}
