package com.vtrade.backend.controller;

import com.vtrade.backend.dto.AccountSummaryResponse;
import com.vtrade.backend.dto.TransactionResponse;
import com.vtrade.backend.exception.UnauthorizedException;
import com.vtrade.backend.security.UserPrincipal;
import com.vtrade.backend.service.account.AccountService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/account")
@RequiredArgsConstructor
@Tag(name = "Account")
public class AccountController {

    private final AccountService accountService;

    @GetMapping
    @Operation(summary = "Balance and margin summary")
    public ResponseEntity<AccountSummaryResponse> summary(@AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(accountService.summary(requireUserId(principal)));
    }

    @GetMapping("/transactions")
    @Operation(summary = "Ledger transactions, newest first")
    public ResponseEntity<List<TransactionResponse>> transactions(@AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(accountService.transactions(requireUserId(principal)).stream()
                .map(TransactionResponse::from)
                .toList());
    }

    private Long requireUserId(UserPrincipal principal) {
        if (principal == null || principal.getUserId() == null) {
            throw new UnauthorizedException("Missing authentication");
        }
        return principal.getUserId();
    }
}
