package com.vtrade.backend.repository;

import com.vtrade.backend.model.RiskAlert;
import com.vtrade.backend.model.RiskAlertType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

public interface RiskAlertRepository extends JpaRepository<RiskAlert, Long> {

    boolean existsByTradingAccountIdAndTypeAndResolvedFalse(Long tradingAccountId, RiskAlertType type);

    List<RiskAlert> findByResolvedOrderByCreatedAtDesc(boolean resolved);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE RiskAlert a SET a.resolved = true, a.resolvedAt = :now "
            + "WHERE a.tradingAccountId = :accountId AND a.type = :type AND a.resolved = false")
    int resolveOpen(@Param("accountId") Long accountId, @Param("type") RiskAlertType type,
                    @Param("now") LocalDateTime now);
}
