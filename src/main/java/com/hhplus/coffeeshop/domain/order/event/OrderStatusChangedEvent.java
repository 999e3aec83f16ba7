package com.hhplus.coffeeshop.domain.order.event;

import com.hhplus.coffeeshop.domain.order.OrderStatus;
import lombok.Getter;
import lombok.ToString;
import org.springframework.context.ApplicationEvent;

import java.time.LocalDateTime;

/**
 * 주문 상태 변경 이벤트
 *
 * 커밋 이후 사용자 알림 생성과 관리자 변경 이력 기록에 사용됩니다.
 * actorAdminId가 null이면 사용자 본인의 변경(취소)입니다.
 */
@Getter
@ToString
public class OrderStatusChangedEvent extends ApplicationEvent {

    private final Long orderId;
    private final String orderNumber;
    private final Long userId;
    private final OrderStatus previousStatus;
    private final OrderStatus newStatus;
    private final Long actorAdminId;
    private final String notes;
    private final LocalDateTime occurredAt;

    public OrderStatusChangedEvent(Object source, Long orderId, String orderNumber, Long userId,
                                   OrderStatus previousStatus, OrderStatus newStatus,
                                   Long actorAdminId, String notes, LocalDateTime occurredAt) {
        super(source);
        this.orderId = orderId;
        this.orderNumber = orderNumber;
        this.userId = userId;
        this.previousStatus = previousStatus;
        this.newStatus = newStatus;
        this.actorAdminId = actorAdminId;
        this.notes = notes;
        this.occurredAt = occurredAt;
    }

    public boolean isAdminAction() {
        return actorAdminId != null;
    }
}
