package com.hhplus.coffeeshop.presentation.order.mapper;

import com.hhplus.coffeeshop.application.order.dto.CreateOrderCommand;
import com.hhplus.coffeeshop.application.order.dto.OrderLineView;
import com.hhplus.coffeeshop.application.order.dto.OrderStatusHistoryView;
import com.hhplus.coffeeshop.application.order.dto.OrderTrackingView;
import com.hhplus.coffeeshop.application.order.dto.OrderView;
import com.hhplus.coffeeshop.application.order.dto.ReorderResult;
import com.hhplus.coffeeshop.domain.order.OrderType;
import com.hhplus.coffeeshop.domain.order.PaymentMethod;
import com.hhplus.coffeeshop.presentation.order.request.CreateOrderRequest;
import com.hhplus.coffeeshop.presentation.order.response.OrderLineResponse;
import com.hhplus.coffeeshop.presentation.order.response.OrderResponse;
import com.hhplus.coffeeshop.presentation.order.response.OrderStatusHistoryResponse;
import com.hhplus.coffeeshop.presentation.order.response.OrderTrackingResponse;
import com.hhplus.coffeeshop.presentation.order.response.ReorderResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderMapper - Presentation layer와 Application layer 간의 DTO 변환
 */
@Component
public class OrderMapper {

    /**
     * CreateOrderRequest → CreateOrderCommand
     *
     * @throws IllegalArgumentException 알 수 없는 주문 유형 / 결제 수단
     */
    public CreateOrderCommand toCreateOrderCommand(CreateOrderRequest request) {
        return CreateOrderCommand.builder()
                .orderType(OrderType.fromString(request.getOrderType()))
                .paymentMethod(PaymentMethod.fromString(request.getPaymentMethod()))
                .storeId(request.getStoreId())
                .deliveryAddress(request.getDeliveryAddress())
                .tableNumber(request.getTableNumber())
                .notes(request.getNotes())
                .voucherCode(request.getVoucherCode())
                .build();
    }

    public OrderResponse toOrderResponse(OrderView view) {
        return OrderResponse.builder()
                .orderId(view.getOrderId())
                .orderNumber(view.getOrderNumber())
                .userId(view.getUserId())
                .orderType(view.getOrderType().name())
                .storeId(view.getStoreId())
                .deliveryAddress(view.getDeliveryAddress())
                .tableNumber(view.getTableNumber())
                .notes(view.getNotes())
                .subtotal(view.getSubtotal())
                .discountAmount(view.getDiscountAmount())
                .deliveryFee(view.getDeliveryFee())
                .totalAmount(view.getTotalAmount())
                .voucherCode(view.getVoucherCode())
                .paymentMethod(view.getPaymentMethod().name())
                .paymentStatus(view.getPaymentStatus().name())
                .status(view.getStatus().name())
                .estimatedReadyAt(view.getEstimatedReadyAt())
                .cancellationReason(view.getCancellationReason())
                .createdAt(view.getCreatedAt())
                .completedAt(view.getCompletedAt())
                .cancelledAt(view.getCancelledAt())
                .lines(view.getLines().stream()
                        .map(this::toOrderLineResponse)
                        .collect(Collectors.toList()))
                .build();
    }

    public List<OrderResponse> toOrderResponses(List<OrderView> views) {
        return views.stream()
                .map(this::toOrderResponse)
                .collect(Collectors.toList());
    }

    public OrderTrackingResponse toTrackingResponse(OrderTrackingView view) {
        return OrderTrackingResponse.builder()
                .orderId(view.getOrderId())
                .orderNumber(view.getOrderNumber())
                .orderType(view.getOrderType().name())
                .status(view.getStatus().name())
                .estimatedReadyAt(view.getEstimatedReadyAt())
                .steps(view.getSteps().stream()
                        .map(step -> OrderTrackingResponse.StepResponse.builder()
                                .status(step.getStatus().name())
                                .label(step.getLabel())
                                .done(step.isDone())
                                .current(step.isCurrent())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }

    public ReorderResponse toReorderResponse(ReorderResult result) {
        return ReorderResponse.builder()
                .orderId(result.getOrderId())
                .addedLines(result.getAddedLines())
                .skippedLines(result.getSkippedLines())
                .build();
    }

    public List<OrderStatusHistoryResponse> toHistoryResponses(List<OrderStatusHistoryView> views) {
        return views.stream()
                .map(view -> OrderStatusHistoryResponse.builder()
                        .historyId(view.getHistoryId())
                        .oldStatus(view.getOldStatus().name())
                        .newStatus(view.getNewStatus().name())
                        .changedByAdminId(view.getChangedByAdminId())
                        .notes(view.getNotes())
                        .changedAt(view.getChangedAt())
                        .build())
                .collect(Collectors.toList());
    }

    private OrderLineResponse toOrderLineResponse(OrderLineView line) {
        return OrderLineResponse.builder()
                .orderLineId(line.getOrderLineId())
                .productId(line.getProductId())
                .productName(line.getProductName())
                .size(line.getSize().name())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .sugarLevel(line.getSugarLevel())
                .iceLevel(line.getIceLevel())
                .temperature(line.getTemperature().name())
                .toppingIds(line.getToppingIds())
                .toppingCost(line.getToppingCost())
                .lineSubtotal(line.getLineSubtotal())
                .build();
    }
}
