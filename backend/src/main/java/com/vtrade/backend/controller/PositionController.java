package com.vtrade.backend.controller;

import com.vtrade.backend.dto.ClosePositionRequest;
import com.vtrade.backend.dto.ClosePositionResponse;
import com.vtrade.backend.dto.PositionResponse;
import com.vtrade.backend.dto.UpdateProtectionRequest;
import com.vtrade.backend.exception.UnauthorizedException;
import com.vtrade.backend.model.TradingAccount;
import com.vtrade.backend.security.UserPrincipal;
import com.vtrade.backend.service.ledger.LedgerService;
import com.vtrade.backend.service.position.PositionCloseService;
import com.vtrade.backend.service.position.PositionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/positions")
@RequiredArgsConstructor
@Tag(name = "Positions")
public class PositionController {

    private final PositionService positionService;
    private final PositionCloseService positionCloseService;
    private final LedgerService ledgerService;

    @GetMapping
    @Operation(summary = "List positions")
    public ResponseEntity<List<PositionResponse>> listPositions(@AuthenticationPrincipal UserPrincipal principal,
                                                                @RequestParam(defaultValue = "true") boolean openOnly) {
        TradingAccount account = ledgerService.getAccountForUser(requireUserId(principal));
        return ResponseEntity.ok(positionService.listPositions(account.getId(), openOnly).stream()
                .map(PositionResponse::from)
                .toList());
    }

    @PostMapping("/{positionId}/close")
    @Operation(summary = "Close position fully or partially")
    public ResponseEntity<ClosePositionResponse> closePosition(@AuthenticationPrincipal UserPrincipal principal,
                                                               @PathVariable Long positionId,
                                                               @Valid @RequestBody(required = false) ClosePositionRequest request) {
        Long userId = requireUserId(principal);
        ClosePositionRequest effective = request != null ? request : new ClosePositionRequest();
        return ResponseEntity.ok(positionCloseService.closePosition(userId, positionId, effective));
    }

    @PutMapping("/{positionId}/protection")
    @Operation(summary = "Set stop-loss and target")
    public ResponseEntity<PositionResponse> updateProtection(@AuthenticationPrincipal UserPrincipal principal,
                                                             @PathVariable Long positionId,
                                                             @Valid @RequestBody UpdateProtectionRequest request) {
        TradingAccount account = ledgerService.getAccountForUser(requireUserId(principal));
        return ResponseEntity.ok(PositionResponse.from(positionService.updateProtection(account.getId(), positionId, request)));
    }

    private Long requireUserId(UserPrincipal principal) {
        if (principal == null || principal.getUserId() == null) {
            throw new UnauthorizedException("Missing authentication");
        }
        return principal.getUserId();
    }
}
