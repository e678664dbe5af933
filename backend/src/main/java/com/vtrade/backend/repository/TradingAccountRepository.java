package com.vtrade.backend.repository;

import com.vtrade.backend.model.TradingAccount;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Fund mutations are single UPDATE statements with relative increments so that concurrent writers from
 * different processes compose instead of overwriting each other. Methods returning {@code int} report the
 * number of rows changed; 0 means the guard rejected the update.
 */
public interface TradingAccountRepository extends JpaRepository<TradingAccount, Long> {

    Optional<TradingAccount> findByUserId(Long userId);

    /** Row lock that serialises position settlement for one account across processes. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM TradingAccount a WHERE a.id = :id")
    Optional<TradingAccount> findByIdForUpdate(@Param("id") Long id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE TradingAccount a SET a.availableMargin = a.availableMargin - :amount, "
            + "a.usedMargin = a.usedMargin + :amount, a.version = a.version + 1, a.updatedAt = :now "
            + "WHERE a.id = :id AND a.availableMargin >= :amount")
    int blockMargin(@Param("id") Long id, @Param("amount") BigDecimal amount, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE TradingAccount a SET a.availableMargin = a.availableMargin + :amount, "
            + "a.usedMargin = a.usedMargin - :amount, a.version = a.version + 1, a.updatedAt = :now "
            + "WHERE a.id = :id")
    int releaseMargin(@Param("id") Long id, @Param("amount") BigDecimal amount, @Param("now") LocalDateTime now);

    /** Moves settled charges out of the account: the reserved part of usedMargin leaves the balance. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE TradingAccount a SET a.usedMargin = a.usedMargin - :amount, "
            + "a.balance = a.balance - :amount, a.version = a.version + 1, a.updatedAt = :now "
            + "WHERE a.id = :id")
    int settleFromUsed(@Param("id") Long id, @Param("amount") BigDecimal amount, @Param("now") LocalDateTime now);

    /** Signed change to balance and availableMargin together. Never rejected. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE TradingAccount a SET a.balance = a.balance + :delta, "
            + "a.availableMargin = a.availableMargin + :delta, a.version = a.version + 1, a.updatedAt = :now "
            + "WHERE a.id = :id")
    int applyFundsDelta(@Param("id") Long id, @Param("delta") BigDecimal delta, @Param("now") LocalDateTime now);

    /** Discretionary debit; refused when availableMargin would go below zero. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE TradingAccount a SET a.balance = a.balance - :amount, "
            + "a.availableMargin = a.availableMargin - :amount, a.version = a.version + 1, a.updatedAt = :now "
            + "WHERE a.id = :id AND a.availableMargin >= :amount")
    int debitAvailable(@Param("id") Long id, @Param("amount") BigDecimal amount, @Param("now") LocalDateTime now);
}
