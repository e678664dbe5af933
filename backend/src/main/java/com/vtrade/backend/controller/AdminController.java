package com.vtrade.backend.controller;

import com.vtrade.backend.dto.AccountSummaryResponse;
import com.vtrade.backend.dto.AdminPatchPositionRequest;
import com.vtrade.backend.dto.AdminPatchPositionResponse;
import com.vtrade.backend.dto.AdminPlaceOrderRequest;
import com.vtrade.backend.dto.CancelOrderResponse;
import com.vtrade.backend.dto.FundsRequest;
import com.vtrade.backend.dto.OrderResponse;
import com.vtrade.backend.dto.PositionRelatedResponse;
import com.vtrade.backend.dto.RiskConfigRequest;
import com.vtrade.backend.exception.UnauthorizedException;
import com.vtrade.backend.model.RiskAlert;
import com.vtrade.backend.model.RiskConfig;
import com.vtrade.backend.model.WorkerHeartbeat;
import com.vtrade.backend.security.UserPrincipal;
import com.vtrade.backend.service.account.AccountService;
import com.vtrade.backend.service.admin.AdminPositionService;
import com.vtrade.backend.service.order.OrderService;
import com.vtrade.backend.service.risk.RiskAlertService;
import com.vtrade.backend.service.risk.RiskConfigService;
import com.vtrade.backend.service.worker.RiskMonitorWorker;
import com.vtrade.backend.service.worker.RiskMonitorWorker.RiskMonitorResult;
import com.vtrade.backend.service.worker.WorkerHeartbeatService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Admin surface. Role checks are enforced by the security filter chain for every path under
 * {@code /api/admin}.
 */
@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Tag(name = "Admin")
public class AdminController {

    private final AdminPositionService adminPositionService;
    private final AccountService accountService;
    private final OrderService orderService;
    private final RiskConfigService riskConfigService;
    private final WorkerHeartbeatService workerHeartbeatService;
    private final RiskAlertService riskAlertService;
    private final RiskMonitorWorker riskMonitorWorker;

    @PatchMapping("/positions/{positionId}")
    @Operation(summary = "Override position fields with optional fund and history cascade")
    public ResponseEntity<AdminPatchPositionResponse> patchPosition(@AuthenticationPrincipal UserPrincipal principal,
                                                                    @PathVariable Long positionId,
                                                                    @Valid @RequestBody AdminPatchPositionRequest request) {
        Long adminId = requireUserId(principal);
        log.warn("Admin {} overriding position {}", adminId, positionId);
        return ResponseEntity.ok(adminPositionService.patchPosition(adminId, positionId, request));
    }

    @GetMapping("/positions/{positionId}/related")
    @Operation(summary = "Orders and transactions linked to a position")
    public ResponseEntity<PositionRelatedResponse> related(@PathVariable Long positionId) {
        return ResponseEntity.ok(adminPositionService.related(positionId));
    }

    @PostMapping("/accounts/{userId}/deposit")
    @Operation(summary = "Deposit funds")
    public ResponseEntity<AccountSummaryResponse> deposit(@AuthenticationPrincipal UserPrincipal principal,
                                                          @PathVariable Long userId,
                                                          @Valid @RequestBody FundsRequest request) {
        Long adminId = requireUserId(principal);
        return ResponseEntity.ok(accountService.deposit(adminId, userId, request.getAmount(), request.getNote()));
    }

    @PostMapping("/accounts/{userId}/withdraw")
    @Operation(summary = "Withdraw funds")
    public ResponseEntity<AccountSummaryResponse> withdraw(@AuthenticationPrincipal UserPrincipal principal,
                                                           @PathVariable Long userId,
                                                           @Valid @RequestBody FundsRequest request) {
        Long adminId = requireUserId(principal);
        return ResponseEntity.ok(accountService.withdraw(adminId, userId, request.getAmount(), request.getNote()));
    }

    @PostMapping("/orders")
    @Operation(summary = "Place order on behalf of a user")
    public ResponseEntity<OrderResponse> placeOrder(@AuthenticationPrincipal UserPrincipal principal,
                                                    @Valid @RequestBody AdminPlaceOrderRequest request) {
        Long adminId = requireUserId(principal);
        return ResponseEntity.ok(OrderResponse.from(
                orderService.placeOrderAsAdmin(adminId, request.getUserId(), request.getOrder())));
    }

    @DeleteMapping("/orders/{orderId}")
    @Operation(summary = "Cancel any pending order")
    public ResponseEntity<CancelOrderResponse> cancelOrder(@AuthenticationPrincipal UserPrincipal principal,
                                                           @PathVariable Long orderId) {
        Long adminId = requireUserId(principal);
        return ResponseEntity.ok(orderService.cancelOrderAsAdmin(adminId, orderId));
    }

    @GetMapping("/risk-configs")
    @Operation(summary = "List risk configs")
    public ResponseEntity<List<RiskConfig>> listRiskConfigs() {
        return ResponseEntity.ok(riskConfigService.list());
    }

    @PutMapping("/risk-configs")
    @Operation(summary = "Create or update the risk config for a segment and product type")
    public ResponseEntity<RiskConfig> upsertRiskConfig(@AuthenticationPrincipal UserPrincipal principal,
                                                       @Valid @RequestBody RiskConfigRequest request) {
        Long adminId = requireUserId(principal);
        return ResponseEntity.ok(riskConfigService.upsert(adminId, request));
    }

    @DeleteMapping("/risk-configs/{id}")
    @Operation(summary = "Deactivate a risk config")
    public ResponseEntity<RiskConfig> deactivateRiskConfig(@AuthenticationPrincipal UserPrincipal principal,
                                                           @PathVariable Long id) {
        Long adminId = requireUserId(principal);
        return ResponseEntity.ok(riskConfigService.deactivate(adminId, id));
    }

    @GetMapping("/risk/alerts")
    @Operation(summary = "Risk alerts, open ones by default")
    public ResponseEntity<List<RiskAlert>> riskAlerts(@RequestParam(defaultValue = "false") boolean resolved) {
        return ResponseEntity.ok(riskAlertService.list(resolved));
    }

    @PostMapping("/risk/alerts/{alertId}/resolve")
    @Operation(summary = "Mark a risk alert resolved")
    public ResponseEntity<RiskAlert> resolveRiskAlert(@AuthenticationPrincipal UserPrincipal principal,
                                                      @PathVariable Long alertId) {
        return ResponseEntity.ok(riskAlertService.resolve(requireUserId(principal), alertId));
    }

    @PostMapping("/risk/monitor")
    @Operation(summary = "Run one risk monitoring pass now")
    public ResponseEntity<RiskMonitorResult> runRiskMonitor(@AuthenticationPrincipal UserPrincipal principal) {
        log.warn("Admin {} triggered a risk monitoring pass", requireUserId(principal));
        return ResponseEntity.ok(riskMonitorWorker.processAccounts());
    }

    @GetMapping("/workers")
    @Operation(summary = "Worker heartbeats")
    public ResponseEntity<List<WorkerHeartbeat>> workers() {
        return ResponseEntity.ok(workerHeartbeatService.list());
    }

    private Long requireUserId(UserPrincipal principal) {
        if (principal == null || principal.getUserId() == null) {
            throw new UnauthorizedException("Missing authentication");
        }
        return principal.getUserId();
    }
}
