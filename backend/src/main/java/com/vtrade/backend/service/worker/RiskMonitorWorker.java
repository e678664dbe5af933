package com.vtrade.backend.service.worker;

import com.vtrade.backend.config.WorkerProperties;
import com.vtrade.backend.dto.ClosePositionResponse;
import com.vtrade.backend.exception.TradingException;
import com.vtrade.backend.model.Instrument;
import com.vtrade.backend.model.OrderStatus;
import com.vtrade.backend.model.Position;
import com.vtrade.backend.model.RiskAlertSeverity;
import com.vtrade.backend.model.RiskAlertType;
import com.vtrade.backend.model.TradingAccount;
import com.vtrade.backend.repository.InstrumentRepository;
import com.vtrade.backend.repository.PositionRepository;
import com.vtrade.backend.service.TradingMetrics;
import com.vtrade.backend.service.ledger.LedgerService;
import com.vtrade.backend.service.marketdata.PriceFeed;
import com.vtrade.backend.service.position.PositionCloseService;
import com.vtrade.backend.service.risk.RiskAlertService;
import com.vtrade.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Account-level loss monitor. Unrealized loss is measured against balance plus available margin; past the
 * warning share an alert is raised once, past the auto-close share losing positions are squared off through
 * the normal exit path, worst first, until the account is back under the threshold.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RiskMonitorWorker {

    static final int MAX_BATCH = 1000;
    private static final BigDecimal MAX_UTILIZATION = new BigDecimal("99999.9999");

    private final PositionRepository positionRepository;
    private final InstrumentRepository instrumentRepository;
    private final LedgerService ledgerService;
    private final PositionCloseService positionCloseService;
    private final RiskAlertService riskAlertService;
    private final PriceFeed priceFeed;
    private final WorkerHeartbeatService heartbeatService;
    private final WorkerProperties workerProperties;
    private final TradingMetrics tradingMetrics;

    public RiskMonitorResult processAccounts() {
        return processAccounts(workerProperties.getRiskMonitor().getBatchLimit());
    }

    public RiskMonitorResult processAccounts(int limit) {
        long started = System.currentTimeMillis();
        WorkerProperties.RiskMonitor config = workerProperties.getRiskMonitor();
        List<Long> accountIds = positionRepository.findAccountIdsWithOpenPositions(PageRequest.of(0, clamp(limit)));
        int alerts = 0;
        int closed = 0;
        int breached = 0;
        int errors = 0;

        for (Long accountId : accountIds) {
            try {
                AccountOutcome outcome = monitorAccount(accountId, config);
                if (outcome.breached()) {
                    breached++;
                }
                if (outcome.alertRaised()) {
                    alerts++;
                }
                closed += outcome.positionsClosed();
            } catch (Exception e) {
                errors++;
                tradingMetrics.recordWorkerError();
                log.error("Risk monitoring failed accountId={}", accountId, e);
            }
        }

        long elapsed = System.currentTimeMillis() - started;
        tradingMetrics.recordRiskSquareOffs(closed);
        heartbeatService.beat(config.getWorkerId(), accountIds.size(), breached, accountIds.size() - breached - errors,
                errors, elapsed);
        log.debug("Risk monitor pass accounts={} breached={} alerts={} closed={} errors={} elapsedMs={}",
                accountIds.size(), breached, alerts, closed, errors, elapsed);
        return new RiskMonitorResult(accountIds.size(), breached, alerts, closed, errors, elapsed);
    }

    private AccountOutcome monitorAccount(Long accountId, WorkerProperties.RiskMonitor config) {
        AccountRisk risk = evaluate(accountId);
        if (risk.utilization().compareTo(config.getAutoCloseThreshold()) >= 0) {
            return squareOff(risk, config);
        }
        if (risk.utilization().compareTo(config.getWarningThreshold()) >= 0) {
            if (riskAlertService.hasOpenAlert(accountId, RiskAlertType.LARGE_LOSS)) {
                return new AccountOutcome(true, false, 0);
            }
            riskAlertService.raise(risk.account(), RiskAlertType.LARGE_LOSS, RiskAlertSeverity.HIGH,
                    "Unrealized loss " + risk.unrealizedLoss().toPlainString() + " is " + percent(risk.utilization())
                            + " of funds " + risk.funds().toPlainString() + "; warning at "
                            + percent(config.getWarningThreshold()),
                    risk.unrealizedLoss(), risk.utilization(), 0);
            return new AccountOutcome(true, true, 0);
        }
        riskAlertService.resolveOpen(accountId, RiskAlertType.LARGE_LOSS);
        return new AccountOutcome(false, false, 0);
    }

    private AccountOutcome squareOff(AccountRisk risk, WorkerProperties.RiskMonitor config) {
        Long accountId = risk.account().getId();
        List<PositionMark> losing = risk.positions().stream()
                .filter(mark -> mark.unrealizedPnl().signum() < 0)
                .sorted(Comparator.comparing(PositionMark::unrealizedPnl))
                .toList();
        log.warn("Auto-close threshold breached accountId={} loss={} funds={} utilization={} losingPositions={}",
                accountId, risk.unrealizedLoss(), risk.funds(), risk.utilization(), losing.size());

        int closed = 0;
        for (PositionMark mark : losing) {
            Long positionId = mark.position().getId();
            try {
                ClosePositionResponse response = positionCloseService.closePosition(risk.account().getUserId(),
                        positionId, null);
                if (response.getExitOrderStatus() == OrderStatus.REJECTED) {
                    log.warn("Square-off exit rejected accountId={} positionId={} reason={}", accountId, positionId,
                            response.getMessage());
                    continue;
                }
                closed++;
                log.warn("Square-off accountId={} positionId={} symbol={} unrealizedPnl={} exitOrderId={} status={}",
                        accountId, positionId, mark.position().getSymbol(), mark.unrealizedPnl(),
                        response.getExitOrderId(), response.getExitOrderStatus());
            } catch (TradingException e) {
                log.warn("Square-off refused accountId={} positionId={} code={} reason={}", accountId, positionId,
                        e.getErrorCode(), e.getMessage());
            }
            if (evaluate(accountId).utilization().compareTo(config.getAutoCloseThreshold()) < 0) {
                break;
            }
        }

        boolean raise = closed > 0 || !riskAlertService.hasOpenAlert(accountId, RiskAlertType.MARGIN_CALL);
        if (raise) {
            riskAlertService.raise(risk.account(), RiskAlertType.MARGIN_CALL, RiskAlertSeverity.CRITICAL,
                    "Auto-closed " + closed + " position(s): unrealized loss " + risk.unrealizedLoss().toPlainString()
                            + " reached " + percent(risk.utilization()) + " of funds " + risk.funds().toPlainString()
                            + "; auto-close at " + percent(config.getAutoCloseThreshold()),
                    risk.unrealizedLoss(), risk.utilization(), closed);
        }
        return new AccountOutcome(true, raise, closed);
    }

    /**
     * Marks every open position of the account at its live price, falling back to the last stored unrealized
     * P&L when the instrument has none.
     */
    AccountRisk evaluate(Long accountId) {
        TradingAccount account = ledgerService.getAccount(accountId);
        List<Position> open = positionRepository.findByTradingAccountIdAndQuantityNotOrderByOpenedAtDesc(accountId, 0);
        Map<Long, Instrument> instruments = new HashMap<>();
        instrumentRepository.findAllById(open.stream().map(Position::getInstrumentId).distinct().toList())
                .forEach(instrument -> instruments.put(instrument.getId(), instrument));

        List<PositionMark> marks = new ArrayList<>();
        BigDecimal total = MoneyUtils.ZERO;
        for (Position position : open) {
            Optional<BigDecimal> price = priceFeed.getLastPrice(instruments.get(position.getInstrumentId()));
            BigDecimal unrealized = price
                    .map(p -> PositionPnlWorker.computeMarks(position, p, p).unrealizedPnl())
                    .orElse(MoneyUtils.scale(position.getUnrealizedPnl()));
            marks.add(new PositionMark(position, unrealized));
            total = MoneyUtils.add(total, unrealized);
        }
        BigDecimal loss = total.signum() < 0 ? total.negate() : MoneyUtils.ZERO;
        BigDecimal funds = MoneyUtils.add(account.getBalance(), account.getAvailableMargin());
        return new AccountRisk(account, marks, loss, funds, utilization(loss, funds));
    }

    /**
     * Loss as a share of funds. With no funds left any loss counts as fully utilized.
     */
    static BigDecimal utilization(BigDecimal loss, BigDecimal funds) {
        if (loss.signum() <= 0) {
            return BigDecimal.ZERO.setScale(4);
        }
        if (funds.signum() <= 0) {
            return BigDecimal.ONE.setScale(4);
        }
        return loss.divide(funds, 4, RoundingMode.HALF_UP).min(MAX_UTILIZATION);
    }

    private static String percent(BigDecimal share) {
        return share.movePointRight(2).setScale(2, RoundingMode.HALF_UP).toPlainString() + "%";
    }

    static int clamp(int limit) {
        return Math.max(1, Math.min(MAX_BATCH, limit));
    }

    record PositionMark(Position position, BigDecimal unrealizedPnl) {
    }

    record AccountRisk(TradingAccount account, List<PositionMark> positions, BigDecimal unrealizedLoss,
                       BigDecimal funds, BigDecimal utilization) {
    }

    private record AccountOutcome(boolean breached, boolean alertRaised, int positionsClosed) {
    }

    public record RiskMonitorResult(int accounts, int breached, int alertsRaised, int positionsClosed, int errors,
                                    long elapsedMs) {
    }
}
