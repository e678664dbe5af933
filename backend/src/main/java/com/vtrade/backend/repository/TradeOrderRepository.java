package com.vtrade.backend.repository;

import com.vtrade.backend.model.OrderSide;
import com.vtrade.backend.model.OrderStatus;
import com.vtrade.backend.model.ProductType;
import com.vtrade.backend.model.TradeOrder;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface TradeOrderRepository extends JpaRepository<TradeOrder, Long> {

    List<TradeOrder> findByTradingAccountIdOrderByCreatedAtDesc(Long tradingAccountId);

    List<TradeOrder> findByTradingAccountIdAndStatusOrderByCreatedAtDesc(Long tradingAccountId, OrderStatus status);

    Optional<TradeOrder> findByIdAndTradingAccountId(Long id, Long tradingAccountId);

    List<TradeOrder> findByPositionIdOrderByCreatedAtAsc(Long positionId);

    List<TradeOrder> findByPositionIdAndStatus(Long positionId, OrderStatus status);

    long countByStatus(OrderStatus status);

    long countByTradingAccountIdAndStatus(Long tradingAccountId, OrderStatus status);

    @Query("SELECT o.tradingAccountId FROM TradeOrder o WHERE o.id = :id")
    Optional<Long> findTradingAccountIdById(@Param("id") Long id);

    /** Quantity already committed to PENDING exit orders on one side of a holding. */
    @Query("SELECT COALESCE(SUM(o.quantity), 0) FROM TradeOrder o WHERE o.tradingAccountId = :accountId "
            + "AND o.instrumentId = :instrumentId AND o.productType = :productType AND o.orderSide = :side "
            + "AND o.exitOrder = true AND o.status = com.vtrade.backend.model.OrderStatus.PENDING")
    long sumPendingExitQuantity(@Param("accountId") Long accountId,
                                @Param("instrumentId") Long instrumentId,
                                @Param("productType") ProductType productType,
                                @Param("side") OrderSide side);

    @Query("SELECT o FROM TradeOrder o WHERE o.status = com.vtrade.backend.model.OrderStatus.PENDING "
            + "AND o.executeAfter <= :now ORDER BY o.createdAt ASC, o.id ASC")
    List<TradeOrder> findDuePending(@Param("now") LocalDateTime now, Pageable pageable);

    /**
     * Compare-and-swap on status. Returns 1 when this caller won the transition, 0 when the order was no
     * longer in {@code expected}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE TradeOrder o SET o.status = :target, o.updatedAt = :now "
            + "WHERE o.id = :id AND o.status = :expected")
    int transitionStatus(@Param("id") Long id,
                         @Param("expected") OrderStatus expected,
                         @Param("target") OrderStatus target,
                         @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE TradeOrder o SET o.status = com.vtrade.backend.model.OrderStatus.REJECTED, "
            + "o.rejectionReason = :reason, o.updatedAt = :now "
            + "WHERE o.id = :id AND o.status = com.vtrade.backend.model.OrderStatus.PENDING")
    int markRejected(@Param("id") Long id, @Param("reason") String reason, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE TradeOrder o SET o.status = com.vtrade.backend.model.OrderStatus.EXECUTED, "
            + "o.filledQuantity = o.quantity, o.averagePrice = :fillPrice, o.executedAt = :now, o.updatedAt = :now "
            + "WHERE o.id = :id AND o.status = com.vtrade.backend.model.OrderStatus.PENDING")
    int markExecuted(@Param("id") Long id, @Param("fillPrice") BigDecimal fillPrice, @Param("now") LocalDateTime now);

    /** Re-prices a PENDING order; 0 rows when the order already left PENDING. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE TradeOrder o SET o.quantity = :quantity, o.price = :price, o.quotedPrice = :quotedPrice, "
            + "o.marginBlocked = :margin, o.chargesBlocked = :charges, o.updatedAt = :now "
            + "WHERE o.id = :id AND o.status = com.vtrade.backend.model.OrderStatus.PENDING")
    int updatePendingTerms(@Param("id") Long id,
                           @Param("quantity") Integer quantity,
                           @Param("price") BigDecimal price,
                           @Param("quotedPrice") BigDecimal quotedPrice,
                           @Param("margin") BigDecimal margin,
                           @Param("charges") BigDecimal charges,
                           @Param("now") LocalDateTime now);
}
