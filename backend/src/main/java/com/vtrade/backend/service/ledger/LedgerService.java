package com.vtrade.backend.service.ledger;

import com.vtrade.backend.exception.InsufficientMarginException;
import com.vtrade.backend.exception.NotFoundException;
import com.vtrade.backend.model.LedgerTransaction;
import com.vtrade.backend.model.TradingAccount;
import com.vtrade.backend.model.TransactionCategory;
import com.vtrade.backend.model.TransactionType;
import com.vtrade.backend.repository.LedgerTransactionRepository;
import com.vtrade.backend.repository.TradingAccountRepository;
import com.vtrade.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Fund primitives. Each one applies a single relative UPDATE to the trading account and appends the matching
 * {@link LedgerTransaction} in the caller's transaction, so {@code balance == availableMargin + usedMargin}
 * holds whenever the surrounding transaction commits. Zero amounts are no-ops.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LedgerService {

    private final TradingAccountRepository accountRepository;
    private final LedgerTransactionRepository transactionRepository;

    public TradingAccount getAccount(Long accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new NotFoundException("Trading account not found"));
    }

    public TradingAccount getAccountForUser(Long userId) {
        return accountRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("Trading account not found"));
    }

    /** Takes the account row lock for the rest of the current transaction. */
    @Transactional
    public TradingAccount lockAccount(Long accountId) {
        return accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new NotFoundException("Trading account not found"));
    }

    /**
     * Moves {@code amount} from available to used margin, or throws without changing anything when available
     * margin is short. An amount exactly equal to available margin succeeds.
     */
    @Transactional
    public void blockMargin(Long accountId, BigDecimal amount, String description, Long orderId) {
        if (!tryBlockMargin(accountId, amount, description, orderId)) {
            TradingAccount account = getAccount(accountId);
            throw new InsufficientMarginException(MoneyUtils.scale(amount), MoneyUtils.scale(account.getAvailableMargin()));
        }
    }

    @Transactional
    public boolean tryBlockMargin(Long accountId, BigDecimal amount, String description, Long orderId) {
        BigDecimal value = MoneyUtils.scale(amount);
        if (value.signum() == 0) {
            return true;
        }
        requirePositive(value);
        int updated = accountRepository.blockMargin(accountId, value, LocalDateTime.now());
        if (updated == 0) {
            log.info("Margin block refused accountId={} amount={}", accountId, value);
            return false;
        }
        record(accountId, TransactionType.DEBIT, TransactionCategory.MARGIN_BLOCK, value, description, orderId, null);
        return true;
    }

    @Transactional
    public void releaseMargin(Long accountId, BigDecimal amount, String description, Long orderId, Long positionId) {
        BigDecimal value = MoneyUtils.scale(amount);
        if (value.signum() == 0) {
            return;
        }
        requirePositive(value);
        accountRepository.releaseMargin(accountId, value, LocalDateTime.now());
        record(accountId, TransactionType.CREDIT, TransactionCategory.MARGIN_RELEASE, value, description, orderId, positionId);
    }

    /** Consumes reserved charges: they leave usedMargin and the balance together. */
    @Transactional
    public void settleCharges(Long accountId, BigDecimal amount, String description, Long orderId) {
        BigDecimal value = MoneyUtils.scale(amount);
        if (value.signum() == 0) {
            return;
        }
        requirePositive(value);
        accountRepository.settleFromUsed(accountId, value, LocalDateTime.now());
        record(accountId, TransactionType.DEBIT, TransactionCategory.CHARGES, value, description, orderId, null);
    }

    /**
     * Books realized P&L into balance and available margin. A loss is applied in full even if it takes
     * available margin below zero; the shortfall is logged for follow-up.
     */
    @Transactional
    public void applyRealizedPnl(Long accountId, BigDecimal pnl, String description, Long orderId, Long positionId) {
        BigDecimal value = MoneyUtils.scale(pnl);
        if (value.signum() == 0) {
            return;
        }
        accountRepository.applyFundsDelta(accountId, value, LocalDateTime.now());
        TransactionType type = value.signum() > 0 ? TransactionType.CREDIT : TransactionType.DEBIT;
        record(accountId, type, TransactionCategory.REALIZED_PNL, value.abs(), description, orderId, positionId);
        if (value.signum() < 0) {
            TradingAccount account = getAccount(accountId);
            if (account.getAvailableMargin().signum() < 0) {
                log.warn("Realized loss left available margin negative accountId={} available={} loss={}",
                        accountId, account.getAvailableMargin(), value);
            }
        }
    }

    @Transactional
    public LedgerTransaction deposit(Long accountId, BigDecimal amount, String description) {
        BigDecimal value = MoneyUtils.scale(amount);
        requirePositive(value);
        accountRepository.applyFundsDelta(accountId, value, LocalDateTime.now());
        return record(accountId, TransactionType.CREDIT, TransactionCategory.DEPOSIT, value, description, null, null);
    }

    @Transactional
    public LedgerTransaction withdraw(Long accountId, BigDecimal amount, String description) {
        BigDecimal value = MoneyUtils.scale(amount);
        requirePositive(value);
        debitAvailableOrThrow(accountId, value);
        return record(accountId, TransactionType.DEBIT, TransactionCategory.WITHDRAWAL, value, description, null, null);
    }

    /**
     * Signed admin adjustment. Credits always apply; debits are refused when available margin is short.
     */
    @Transactional
    public LedgerTransaction adjust(Long accountId, BigDecimal delta, String description, Long positionId) {
        BigDecimal value = MoneyUtils.scale(delta);
        if (value.signum() == 0) {
            return null;
        }
        if (value.signum() > 0) {
            accountRepository.applyFundsDelta(accountId, value, LocalDateTime.now());
            return record(accountId, TransactionType.CREDIT, TransactionCategory.ADJUSTMENT, value, description, null, positionId);
        }
        BigDecimal debit = value.negate();
        debitAvailableOrThrow(accountId, debit);
        return record(accountId, TransactionType.DEBIT, TransactionCategory.ADJUSTMENT, debit, description, null, positionId);
    }

    private void debitAvailableOrThrow(Long accountId, BigDecimal amount) {
        int updated = accountRepository.debitAvailable(accountId, amount, LocalDateTime.now());
        if (updated == 0) {
            TradingAccount account = getAccount(accountId);
            throw new InsufficientMarginException(amount, MoneyUtils.scale(account.getAvailableMargin()));
        }
    }

    private LedgerTransaction record(Long accountId, TransactionType type, TransactionCategory category,
                                     BigDecimal amount, String description, Long orderId, Long positionId) {
        LedgerTransaction transaction = LedgerTransaction.builder()
                .tradingAccountId(accountId)
                .type(type)
                .category(category)
                .amount(amount)
                .description(description)
                .orderId(orderId)
                .positionId(positionId)
                .createdAt(LocalDateTime.now())
                .build();
        log.debug("Ledger {} {} amount={} accountId={} orderId={} positionId={}",
                type, category, amount, accountId, orderId, positionId);
        return transactionRepository.save(transaction);
    }

    private void requirePositive(BigDecimal value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("amount must not be negative: " + value);
        }
    }
}
