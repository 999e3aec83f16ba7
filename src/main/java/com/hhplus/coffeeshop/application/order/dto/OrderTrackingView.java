package com.hhplus.coffeeshop.application.order.dto;

import com.hhplus.coffeeshop.domain.order.OrderStatus;
import com.hhplus.coffeeshop.domain.order.OrderType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 추적 타임라인
 *
 * 취소된 주문은 빈 타임라인을 가집니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderTrackingView {
    private Long orderId;
    private String orderNumber;
    private OrderType orderType;
    private OrderStatus status;
    private LocalDateTime estimatedReadyAt;
    private List<Step> steps;

    @Getter
    @AllArgsConstructor
    public static class Step {
        private final OrderStatus status;
        private final String label;
        private final boolean done;
        private final boolean current;
    }
}
