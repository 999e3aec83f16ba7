package com.hhplus.coffeeshop.domain.order;

/**
 * 결제 수단 태그 (결제 연동 없이 주문에 기록만 합니다)
 */
public enum PaymentMethod {
    CASH,
    MOMO,
    SHOPEEPAY,
    ZALOPAY,
    APPLEPAY,
    GOOGLEPAY,
    CARD;

    public static PaymentMethod fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("결제 수단은 필수입니다");
        }
        try {
            return PaymentMethod.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("유효하지 않은 결제 수단입니다: " + value, e);
        }
    }
}
