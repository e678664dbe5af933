package com.vtrade.backend.repository;

import com.vtrade.backend.model.LedgerTransaction;
import com.vtrade.backend.model.TransactionCategory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, Long> {

    List<LedgerTransaction> findByTradingAccountIdOrderByCreatedAtDescIdDesc(Long tradingAccountId);

    List<LedgerTransaction> findByPositionIdOrderByIdAsc(Long positionId);

    List<LedgerTransaction> findByOrderIdOrderByIdAsc(Long orderId);

    List<LedgerTransaction> findByOrderIdAndCategory(Long orderId, TransactionCategory category);
}
