package com.hhplus.coffeeshop.domain.order;

public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED,
    REFUNDED;

    public static PaymentStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("결제 상태는 필수입니다");
        }
        try {
            return PaymentStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("유효하지 않은 결제 상태입니다: " + value, e);
        }
    }
}
