package com.hhplus.coffeeshop.domain.cart;

import lombok.Getter;

/**
 * 음료 온도
 */
@Getter
public enum Temperature {
    HOT("따뜻하게"),
    COLD("차갑게");

    private final String displayName;

    Temperature(String displayName) {
        this.displayName = displayName;
    }

    public static Temperature fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("온도는 필수입니다");
        }
        try {
            return Temperature.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("유효하지 않은 온도입니다: " + value, e);
        }
    }
}
