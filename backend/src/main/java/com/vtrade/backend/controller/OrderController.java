package com.vtrade.backend.controller;

import com.vtrade.backend.dto.CancelOrderResponse;
import com.vtrade.backend.dto.MarginQuoteResponse;
import com.vtrade.backend.dto.ModifyOrderRequest;
import com.vtrade.backend.dto.OrderResponse;
import com.vtrade.backend.dto.PlaceOrderRequest;
import com.vtrade.backend.exception.UnauthorizedException;
import com.vtrade.backend.model.OrderStatus;
import com.vtrade.backend.security.UserPrincipal;
import com.vtrade.backend.service.order.OrderService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
@Tag(name = "Orders")
public class OrderController {

    private final OrderService orderService;

    @PostMapping
    @Operation(summary = "Place order")
    public ResponseEntity<OrderResponse> placeOrder(@AuthenticationPrincipal UserPrincipal principal,
                                                    @Valid @RequestBody PlaceOrderRequest request) {
        Long userId = requireUserId(principal);
        log.info("Placing order for user {} symbol {}", userId, request.getSymbol());
        return ResponseEntity.ok(OrderResponse.from(orderService.placeOrder(userId, request)));
    }

    @PostMapping("/quote")
    @Operation(summary = "Margin and charges for an order without placing it")
    public ResponseEntity<MarginQuoteResponse> quote(@AuthenticationPrincipal UserPrincipal principal,
                                                     @Valid @RequestBody PlaceOrderRequest request) {
        Long userId = requireUserId(principal);
        return ResponseEntity.ok(orderService.quoteOrder(userId, request));
    }

    @GetMapping
    @Operation(summary = "List orders")
    public ResponseEntity<List<OrderResponse>> listOrders(@AuthenticationPrincipal UserPrincipal principal,
                                                          @RequestParam(required = false) OrderStatus status) {
        Long userId = requireUserId(principal);
        return ResponseEntity.ok(orderService.listOrders(userId, status).stream().map(OrderResponse::from).toList());
    }

    @GetMapping("/{orderId}")
    @Operation(summary = "Get order")
    public ResponseEntity<OrderResponse> getOrder(@AuthenticationPrincipal UserPrincipal principal,
                                                  @PathVariable Long orderId) {
        Long userId = requireUserId(principal);
        return ResponseEntity.ok(OrderResponse.from(orderService.getOrder(userId, orderId)));
    }

    @PutMapping("/{orderId}")
    @Operation(summary = "Modify pending order")
    public ResponseEntity<OrderResponse> modifyOrder(@AuthenticationPrincipal UserPrincipal principal,
                                                     @PathVariable Long orderId,
                                                     @Valid @RequestBody ModifyOrderRequest request) {
        Long userId = requireUserId(principal);
        return ResponseEntity.ok(OrderResponse.from(orderService.modifyOrder(userId, orderId, request)));
    }

    @DeleteMapping("/{orderId}")
    @Operation(summary = "Cancel pending order")
    public ResponseEntity<CancelOrderResponse> cancelOrder(@AuthenticationPrincipal UserPrincipal principal,
                                                           @PathVariable Long orderId) {
        Long userId = requireUserId(principal);
        return ResponseEntity.ok(orderService.cancelOrder(userId, orderId));
    }

    private Long requireUserId(UserPrincipal principal) {
        if (principal == null || principal.getUserId() == null) {
            throw new UnauthorizedException("Missing authentication");
        }
        return principal.getUserId();
    }
}
