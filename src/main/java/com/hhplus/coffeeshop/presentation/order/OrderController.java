package com.hhplus.coffeeshop.presentation.order;

import com.hhplus.coffeeshop.application.order.OrderLifecycleService;
import com.hhplus.coffeeshop.application.order.OrderService;
import com.hhplus.coffeeshop.application.order.dto.OrderView;
import com.hhplus.coffeeshop.presentation.order.mapper.OrderMapper;
import com.hhplus.coffeeshop.presentation.order.request.CancelOrderRequest;
import com.hhplus.coffeeshop.presentation.order.request.CreateOrderRequest;
import com.hhplus.coffeeshop.presentation.order.response.OrderResponse;
import com.hhplus.coffeeshop.presentation.order.response.OrderTrackingResponse;
import com.hhplus.coffeeshop.presentation.order.response.ReorderResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * OrderController - Presentation 계층
 * 사용자 주문 API 요청 처리
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderService orderService;
    private final OrderLifecycleService orderLifecycleService;
    private final OrderMapper orderMapper;

    public OrderController(OrderService orderService,
                           OrderLifecycleService orderLifecycleService,
                           OrderMapper orderMapper) {
        this.orderService = orderService;
        this.orderLifecycleService = orderLifecycleService;
        this.orderMapper = orderMapper;
    }

    /**
     * POST /orders - 장바구니로 주문 생성
     */
    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(
            @RequestHeader("X-USER-ID") Long userId,
            @Valid @RequestBody CreateOrderRequest request) {
        OrderView order = orderService.createFromCart(userId, orderMapper.toCreateOrderCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(orderMapper.toOrderResponse(order));
    }

    /**
     * GET /orders - 내 주문 목록 (최신순)
     */
    @GetMapping
    public ResponseEntity<List<OrderResponse>> getMyOrders(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(orderMapper.toOrderResponses(orderService.getForUser(userId)));
    }

    /**
     * GET /orders/{order_id} - 주문 상세
     */
    @GetMapping("/{order_id}")
    public ResponseEntity<OrderResponse> getOrder(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(orderMapper.toOrderResponse(orderService.getOwned(orderId, userId)));
    }

    /**
     * GET /orders/number/{order_number} - 주문번호로 조회
     */
    @GetMapping("/number/{order_number}")
    public ResponseEntity<OrderResponse> getOrderByNumber(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("order_number") String orderNumber) {
        return ResponseEntity.ok(orderMapper.toOrderResponse(orderService.getByNumber(orderNumber, userId)));
    }

    /**
     * GET /orders/{order_id}/tracking - 주문 진행 상황
     */
    @GetMapping("/{order_id}/tracking")
    public ResponseEntity<OrderTrackingResponse> track(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(orderMapper.toTrackingResponse(orderService.track(orderId, userId)));
    }

    /**
     * POST /orders/{order_id}/cancel - 주문 취소 (PENDING, CONFIRMED만 가능)
     */
    @PostMapping("/{order_id}/cancel")
    public ResponseEntity<OrderResponse> cancel(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("order_id") Long orderId,
            @Valid @RequestBody(required = false) CancelOrderRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(orderMapper.toOrderResponse(orderLifecycleService.cancel(orderId, userId, reason)));
    }

    /**
     * POST /orders/{order_id}/reorder - 지난 주문을 장바구니에 다시 담기
     */
    @PostMapping("/{order_id}/reorder")
    public ResponseEntity<ReorderResponse> reorder(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(orderMapper.toReorderResponse(orderService.reorder(orderId, userId)));
    }
}
