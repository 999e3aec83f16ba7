package com.hhplus.coffeeshop.domain.order.event;

import lombok.Getter;
import lombok.ToString;
import org.springframework.context.ApplicationEvent;

import java.time.LocalDateTime;

/**
 * 주문 생성 이벤트
 *
 * 주문 트랜잭션 커밋 이후 포인트 적립에 사용됩니다.
 */
@Getter
@ToString
public class OrderCreatedEvent extends ApplicationEvent {

    private final Long orderId;
    private final String orderNumber;
    private final Long userId;
    private final long totalAmount;
    private final LocalDateTime occurredAt;

    public OrderCreatedEvent(Object source, Long orderId, String orderNumber, Long userId, long totalAmount) {
        super(source);
        this.orderId = orderId;
        this.orderNumber = orderNumber;
        this.userId = userId;
        this.totalAmount = totalAmount;
        this.occurredAt = LocalDateTime.now();
    }
}
