package com.hhplus.coffeeshop.domain.order;

import lombok.Getter;

/**
 * 주문 유형
 * - PICKUP: 매장(storeId) 필수
 * - DELIVERY: 배송지(deliveryAddress) 필수
 * - DINE_IN: 테이블 번호(tableNumber) 필수
 */
@Getter
public enum OrderType {
    PICKUP("포장"),
    DELIVERY("배달"),
    DINE_IN("매장 식사");

    private final String displayName;

    OrderType(String displayName) {
        this.displayName = displayName;
    }

    public static OrderType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("주문 유형은 필수입니다");
        }
        try {
            return OrderType.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("유효하지 않은 주문 유형입니다: " + value, e);
        }
    }
}
