package com.vtrade.backend.service.risk;

import com.vtrade.backend.exception.NotFoundException;
import com.vtrade.backend.model.RiskAlert;
import com.vtrade.backend.model.RiskAlertSeverity;
import com.vtrade.backend.model.RiskAlertType;
import com.vtrade.backend.model.TradingAccount;
import com.vtrade.backend.repository.RiskAlertRepository;
import com.vtrade.backend.service.AuditEventService;
import com.vtrade.backend.service.TradingMetrics;
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
public class RiskAlertService {

    private final RiskAlertRepository riskAlertRepository;
    private final AuditEventService auditEventService;
    private final TradingMetrics tradingMetrics;

    public boolean hasOpenAlert(Long accountId, RiskAlertType type) {
        return riskAlertRepository.existsByTradingAccountIdAndTypeAndResolvedFalse(accountId, type);
    }

    @Transactional
    public RiskAlert raise(TradingAccount account, RiskAlertType type, RiskAlertSeverity severity, String message,
                           BigDecimal unrealizedLoss, BigDecimal utilization, int positionsClosed) {
        RiskAlert alert = riskAlertRepository.save(RiskAlert.builder()
                .tradingAccountId(account.getId())
                .userId(account.getUserId())
                .type(type)
                .severity(severity)
                .message(message.length() > 512 ? message.substring(0, 512) : message)
                .unrealizedLoss(unrealizedLoss)
                .utilization(utilization)
                .positionsClosed(positionsClosed)
                .resolved(false)
                .createdAt(LocalDateTime.now())
                .build());
        tradingMetrics.recordRiskAlert();
        log.warn("Risk alert raised alertId={} accountId={} type={} severity={} utilization={} closed={}",
                alert.getId(), account.getId(), type, severity, utilization, positionsClosed);
        auditEventService.recordEvent(account.getUserId(), "risk", type.name(), "trading_account", account.getId(),
                alert.getMessage(), Map.of("utilization", utilization.toPlainString(), "positionsClosed", positionsClosed));
        return alert;
    }

    /** Clears open alerts of one type once the account is back under the threshold that raised them. */
    @Transactional
    public int resolveOpen(Long accountId, RiskAlertType type) {
        int resolved = riskAlertRepository.resolveOpen(accountId, type, LocalDateTime.now());
        if (resolved > 0) {
            log.info("Risk alerts resolved accountId={} type={} count={}", accountId, type, resolved);
        }
        return resolved;
    }

    @Transactional
    public RiskAlert resolve(Long adminUserId, Long alertId) {
        RiskAlert alert = riskAlertRepository.findById(alertId)
                .orElseThrow(() -> new NotFoundException("Risk alert not found"));
        if (!alert.isResolved()) {
            alert.setResolved(true);
            alert.setResolvedAt(LocalDateTime.now());
            alert = riskAlertRepository.save(alert);
            auditEventService.recordEvent(adminUserId, "risk", "ALERT_RESOLVED", "risk_alert", alertId,
                    "Risk alert resolved by admin", Map.of("type", alert.getType().name()));
        }
        return alert;
    }

    public List<RiskAlert> list(boolean resolved) {
        return riskAlertRepository.findByResolvedOrderByCreatedAtDesc(resolved);
    }
}
