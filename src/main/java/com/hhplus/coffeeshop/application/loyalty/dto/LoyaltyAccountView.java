package com.hhplus.coffeeshop.application.loyalty.dto;

import com.hhplus.coffeeshop.domain.loyalty.LoyaltyTier;
import com.hhplus.coffeeshop.domain.user.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoyaltyAccountView {
    private Long userId;
    private long pointsBalance;
    private LoyaltyTier tier;
    private boolean tierChanged;

    public static LoyaltyAccountView of(User user, boolean tierChanged) {
        return LoyaltyAccountView.builder()
                .userId(user.getUserId())
                .pointsBalance(user.getLoyalty().balance())
                .tier(user.getLoyalty().getTier())
                .tierChanged(tierChanged)
                .build();
    }
}
