package com.hhplus.coffeeshop.domain.notification;

import com.hhplus.coffeeshop.domain.order.OrderStatus;

import java.util.EnumMap;
import java.util.Map;

/**
 * 주문 상태별 사용자 안내 문구
 */
public final class OrderStatusMessages {

    private static final Map<OrderStatus, String> MESSAGES = new EnumMap<>(OrderStatus.class);

    static {
        MESSAGES.put(OrderStatus.PENDING, "주문이 접수되었습니다.");
        MESSAGES.put(OrderStatus.CONFIRMED, "주문이 확인되었습니다.");
        MESSAGES.put(OrderStatus.PREPARING, "음료를 준비하고 있습니다.");
        MESSAGES.put(OrderStatus.READY, "주문하신 음료가 준비되었습니다.");
        MESSAGES.put(OrderStatus.DELIVERING, "주문하신 음료가 배달 중입니다.");
        MESSAGES.put(OrderStatus.COMPLETED, "주문이 완료되었습니다. 이용해 주셔서 감사합니다!");
        MESSAGES.put(OrderStatus.CANCELLED, "주문이 취소되었습니다.");
    }

    private OrderStatusMessages() {
        throw new AssertionError("OrderStatusMessages는 인스턴스화할 수 없습니다");
    }

    public static String messageFor(OrderStatus status) {
        return MESSAGES.getOrDefault(status, "주문 상태가 변경되었습니다.");
    }
}
