package com.hhplus.coffeeshop.domain.product;

import lombok.Getter;

/**
 * CupSize - 음료 사이즈
 *
 * 상품에 사이즈별 가격표가 없을 때 적용되는 기본 가격 조정값을 함께 가집니다.
 * - S: -5000
 * - M: 0
 * - L: +10000
 */
@Getter
public enum CupSize {
    S("스몰", -5_000L),
    M("미디엄", 0L),
    L("라지", 10_000L);

    private final String displayName;
    private final long defaultAdjustment;

    CupSize(String displayName, long defaultAdjustment) {
        this.displayName = displayName;
        this.defaultAdjustment = defaultAdjustment;
    }

    public static CupSize fromString(String size) {
        if (size == null || size.isBlank()) {
            throw new IllegalArgumentException("사이즈는 필수입니다");
        }
        try {
            return CupSize.valueOf(size.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("유효하지 않은 사이즈입니다: " + size, e);
        }
    }
}
