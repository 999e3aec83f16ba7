package com.hhplus.coffeeshop.application.order.dto;

import com.hhplus.coffeeshop.domain.order.OrderStatus;
import com.hhplus.coffeeshop.domain.order.OrderStatusHistory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusHistoryView {
    private Long historyId;
    private Long orderId;
    private OrderStatus oldStatus;
    private OrderStatus newStatus;
    private Long changedByAdminId;
    private String notes;
    private LocalDateTime changedAt;

    public static OrderStatusHistoryView from(OrderStatusHistory history) {
        return OrderStatusHistoryView.builder()
                .historyId(history.getHistoryId())
                .orderId(history.getOrderId())
                .oldStatus(history.getOldStatus())
                .newStatus(history.getNewStatus())
                .changedByAdminId(history.getChangedByAdminId())
                .notes(history.getNotes())
                .changedAt(history.getChangedAt())
                .build();
    }
}
