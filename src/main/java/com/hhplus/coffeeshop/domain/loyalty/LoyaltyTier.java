package com.hhplus.coffeeshop.domain.loyalty;

import lombok.Getter;

/**
 * 멤버십 등급 (포인트 잔액 기준)
 */
@Getter
public enum LoyaltyTier {
    BRONZE("브론즈"),
    SILVER("실버"),
    GOLD("골드");

    private final String displayName;

    LoyaltyTier(String displayName) {
        this.displayName = displayName;
    }
}
