package com.hhplus.coffeeshop.domain.loyalty;

public enum LoyaltyTransactionType {
    EARN,
    REDEEM,
    ADMIN_ADJUSTMENT
}
