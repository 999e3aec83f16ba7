package com.hhplus.coffeeshop.application.order.dto;

import com.hhplus.coffeeshop.domain.order.Order;
import com.hhplus.coffeeshop.domain.order.OrderStatus;
import com.hhplus.coffeeshop.domain.order.OrderType;
import com.hhplus.coffeeshop.domain.order.PaymentMethod;
import com.hhplus.coffeeshop.domain.order.PaymentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 주문 조회 결과 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderView {
    private Long orderId;
    private String orderNumber;
    private Long userId;
    private OrderType orderType;
    private Long storeId;
    private String deliveryAddress;
    private String tableNumber;
    private String notes;
    private Long subtotal;
    private Long discountAmount;
    private Long deliveryFee;
    private Long totalAmount;
    private String voucherCode;
    private PaymentMethod paymentMethod;
    private PaymentStatus paymentStatus;
    private OrderStatus status;
    private LocalDateTime estimatedReadyAt;
    private String cancellationReason;
    private LocalDateTime createdAt;
    private LocalDateTime completedAt;
    private LocalDateTime cancelledAt;
    private List<OrderLineView> lines;

    public static OrderView from(Order order) {
        return OrderView.builder()
                .orderId(order.getOrderId())
                .orderNumber(order.getOrderNumber())
                .userId(order.getUserId())
                .orderType(order.getOrderType())
                .storeId(order.getStoreId())
                .deliveryAddress(order.getDeliveryAddress())
                .tableNumber(order.getTableNumber())
                .notes(order.getNotes())
                .subtotal(order.getSubtotal())
                .discountAmount(order.getDiscountAmount())
                .deliveryFee(order.getDeliveryFee())
                .totalAmount(order.getTotalAmount())
                .voucherCode(order.getVoucherCode())
                .paymentMethod(order.getPaymentMethod())
                .paymentStatus(order.getPaymentStatus())
                .status(order.getStatus())
                .estimatedReadyAt(order.getEstimatedReadyAt())
                .cancellationReason(order.getCancellationReason())
                .createdAt(order.getCreatedAt())
                .completedAt(order.getCompletedAt())
                .cancelledAt(order.getCancelledAt())
                .lines(order.getOrderLines().stream().map(OrderLineView::from).collect(Collectors.toList()))
                .build();
    }
}
