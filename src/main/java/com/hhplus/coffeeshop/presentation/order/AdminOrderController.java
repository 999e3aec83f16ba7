package com.hhplus.coffeeshop.presentation.order;

import com.hhplus.coffeeshop.application.order.OrderLifecycleService;
import com.hhplus.coffeeshop.application.order.OrderService;
import com.hhplus.coffeeshop.presentation.order.mapper.OrderMapper;
import com.hhplus.coffeeshop.presentation.order.request.UpdateOrderStatusRequest;
import com.hhplus.coffeeshop.presentation.order.request.UpdatePaymentStatusRequest;
import com.hhplus.coffeeshop.presentation.order.response.OrderResponse;
import com.hhplus.coffeeshop.presentation.order.response.OrderStatusHistoryResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * AdminOrderController - 매장 직원용 주문 관리 API
 */
@RestController
@RequestMapping("/admin/orders")
public class AdminOrderController {

    private final OrderService orderService;
    private final OrderLifecycleService orderLifecycleService;
    private final OrderMapper orderMapper;

    public AdminOrderController(OrderService orderService,
                                OrderLifecycleService orderLifecycleService,
                                OrderMapper orderMapper) {
        this.orderService = orderService;
        this.orderLifecycleService = orderLifecycleService;
        this.orderMapper = orderMapper;
    }

    /**
     * GET /admin/orders?status= - 상태별 주문 목록 (오래된 순)
     */
    @GetMapping
    public ResponseEntity<List<OrderResponse>> listByStatus(@RequestParam("status") String status) {
        return ResponseEntity.ok(orderMapper.toOrderResponses(orderService.listByStatus(status)));
    }

    /**
     * GET /admin/orders/{order_id} - 주문 단건 조회
     */
    @GetMapping("/{order_id}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(orderMapper.toOrderResponse(orderService.get(orderId)));
    }

    /**
     * PUT /admin/orders/{order_id}/status - 주문 상태 변경
     */
    @PutMapping("/{order_id}/status")
    public ResponseEntity<OrderResponse> updateStatus(
            @RequestHeader("X-ADMIN-ID") Long adminId,
            @PathVariable("order_id") Long orderId,
            @Valid @RequestBody UpdateOrderStatusRequest request) {
        return ResponseEntity.ok(orderMapper.toOrderResponse(
                orderLifecycleService.transitionStatus(orderId, request.getStatus(), adminId, request.getNotes())));
    }

    /**
     * PUT /admin/orders/{order_id}/payment-status - 결제 상태 변경
     */
    @PutMapping("/{order_id}/payment-status")
    public ResponseEntity<OrderResponse> updatePaymentStatus(
            @RequestHeader("X-ADMIN-ID") Long adminId,
            @PathVariable("order_id") Long orderId,
            @Valid @RequestBody UpdatePaymentStatusRequest request) {
        return ResponseEntity.ok(orderMapper.toOrderResponse(
                orderLifecycleService.updatePaymentStatus(orderId, request.getPaymentStatus())));
    }

    /**
     * GET /admin/orders/{order_id}/history - 관리자 상태 변경 이력
     */
    @GetMapping("/{order_id}/history")
    public ResponseEntity<List<OrderStatusHistoryResponse>> history(@PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(orderMapper.toHistoryResponses(orderLifecycleService.history(orderId)));
    }
}
