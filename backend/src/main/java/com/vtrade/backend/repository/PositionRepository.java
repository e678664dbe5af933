package com.vtrade.backend.repository;

import com.vtrade.backend.model.Position;
import com.vtrade.backend.model.ProductType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface PositionRepository extends JpaRepository<Position, Long> {

    Optional<Position> findFirstByTradingAccountIdAndInstrumentIdAndProductTypeAndQuantityNot(
            Long tradingAccountId, Long instrumentId, ProductType productType, Integer quantity);

    default Optional<Position> findOpen(Long tradingAccountId, Long instrumentId, ProductType productType) {
        return findFirstByTradingAccountIdAndInstrumentIdAndProductTypeAndQuantityNot(
                tradingAccountId, instrumentId, productType, 0);
    }

    List<Position> findByTradingAccountIdOrderByOpenedAtDesc(Long tradingAccountId);

    List<Position> findByTradingAccountIdAndQuantityNotOrderByOpenedAtDesc(Long tradingAccountId, Integer quantity);

    Optional<Position> findByIdAndTradingAccountId(Long id, Long tradingAccountId);

    @Query("SELECT p.tradingAccountId FROM Position p WHERE p.id = :id")
    Optional<Long> findTradingAccountIdById(@Param("id") Long id);

    @Query("SELECT p FROM Position p WHERE p.quantity <> 0 ORDER BY p.id ASC")
    List<Position> findOpenPositions(Pageable pageable);

    @Query("SELECT DISTINCT p.tradingAccountId FROM Position p WHERE p.quantity <> 0 ORDER BY p.tradingAccountId ASC")
    List<Long> findAccountIdsWithOpenPositions(Pageable pageable);

    /**
     * Writes only the mark-to-market columns, and only while the position is still open, so a concurrent
     * settlement never has its quantity, average or margin overwritten.
     */
    @Modifying
    @Transactional
    @Query("UPDATE Position p SET p.unrealizedPnl = :unrealized, p.dayPnl = :dayPnl, p.lastPrice = :lastPrice, "
            + "p.updatedAt = :now WHERE p.id = :id AND p.quantity <> 0")
    int updateMarks(@Param("id") Long id,
                    @Param("unrealized") BigDecimal unrealized,
                    @Param("dayPnl") BigDecimal dayPnl,
                    @Param("lastPrice") BigDecimal lastPrice,
                    @Param("now") LocalDateTime now);
}
