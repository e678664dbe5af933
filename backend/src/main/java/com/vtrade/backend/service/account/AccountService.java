package com.vtrade.backend.service.account;

import com.vtrade.backend.dto.AccountSummaryResponse;
import com.vtrade.backend.model.LedgerTransaction;
import com.vtrade.backend.model.OrderStatus;
import com.vtrade.backend.model.Position;
import com.vtrade.backend.model.TradingAccount;
import com.vtrade.backend.repository.LedgerTransactionRepository;
import com.vtrade.backend.repository.PositionRepository;
import com.vtrade.backend.repository.TradeOrderRepository;
import com.vtrade.backend.repository.TradingAccountRepository;
import com.vtrade.backend.service.AuditEventService;
import com.vtrade.backend.service.ledger.LedgerService;
import com.vtrade.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class AccountService {

    private final TradingAccountRepository accountRepository;
    private final PositionRepository positionRepository;
    private final TradeOrderRepository orderRepository;
    private final LedgerTransactionRepository transactionRepository;
    private final LedgerService ledgerService;
    private final AuditEventService auditEventService;

    @Transactional(readOnly = true)
    public AccountSummaryResponse summary(Long userId) {
        return summarize(ledgerService.getAccountForUser(userId));
    }

    @Transactional(readOnly = true)
    public List<LedgerTransaction> transactions(Long userId) {
        TradingAccount account = ledgerService.getAccountForUser(userId);
        return transactionRepository.findByTradingAccountIdOrderByCreatedAtDescIdDesc(account.getId());
    }

    /** Returns the user's trading account, creating an empty one on first use. */
    @Transactional
    public TradingAccount openAccount(Long userId) {
        return accountRepository.findByUserId(userId).orElseGet(() -> {
            LocalDateTime now = LocalDateTime.now();
            TradingAccount account = accountRepository.save(TradingAccount.builder()
                    .userId(userId)
                    .balance(MoneyUtils.ZERO)
                    .availableMargin(MoneyUtils.ZERO)
                    .usedMargin(MoneyUtils.ZERO)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            log.info("Trading account opened accountId={} userId={}", account.getId(), userId);
            return account;
        });
    }

    @Transactional
    public AccountSummaryResponse deposit(Long adminUserId, Long userId, BigDecimal amount, String note) {
        TradingAccount account = openAccount(userId);
        LedgerTransaction transaction = ledgerService.deposit(account.getId(), amount,
                note == null || note.isBlank() ? "Funds deposited" : note);
        log.info("Deposit accountId={} userId={} amount={}", account.getId(), userId, transaction.getAmount());
        auditEventService.recordEvent(adminUserId, "funds", "DEPOSIT", "trading_account", account.getId(),
                "Deposit for user " + userId, Map.of("amount", transaction.getAmount().toPlainString()));
        return summarize(ledgerService.getAccount(account.getId()));
    }

    @Transactional
    public AccountSummaryResponse withdraw(Long adminUserId, Long userId, BigDecimal amount, String note) {
        TradingAccount account = ledgerService.getAccountForUser(userId);
        LedgerTransaction transaction = ledgerService.withdraw(account.getId(), amount,
                note == null || note.isBlank() ? "Funds withdrawn" : note);
        log.info("Withdrawal accountId={} userId={} amount={}", account.getId(), userId, transaction.getAmount());
        auditEventService.recordEvent(adminUserId, "funds", "WITHDRAWAL", "trading_account", account.getId(),
                "Withdrawal for user " + userId, Map.of("amount", transaction.getAmount().toPlainString()));
        return summarize(ledgerService.getAccount(account.getId()));
    }

    private AccountSummaryResponse summarize(TradingAccount account) {
        List<Position> open = positionRepository.findByTradingAccountIdAndQuantityNotOrderByOpenedAtDesc(account.getId(), 0);
        BigDecimal unrealized = MoneyUtils.ZERO;
        BigDecimal day = MoneyUtils.ZERO;
        for (Position position : open) {
            unrealized = MoneyUtils.add(unrealized, position.getUnrealizedPnl());
            day = MoneyUtils.add(day, position.getDayPnl());
        }
        return AccountSummaryResponse.builder()
                .accountId(account.getId())
                .userId(account.getUserId())
                .balance(MoneyUtils.scale(account.getBalance()))
                .availableMargin(MoneyUtils.scale(account.getAvailableMargin()))
                .usedMargin(MoneyUtils.scale(account.getUsedMargin()))
                .openPositions(open.size())
                .pendingOrders(orderRepository.countByTradingAccountIdAndStatus(account.getId(), OrderStatus.PENDING))
                .unrealizedPnl(unrealized)
                .dayPnl(day)
                .build();
    }
}
