package com.hhplus.coffeeshop.presentation.loyalty.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoyaltyAccountResponse {

    @JsonProperty("user_id")
    private Long userId;

    @JsonProperty("points_balance")
    private Long pointsBalance;

    private String tier;

    @JsonProperty("tier_changed")
    private Boolean tierChanged;
}
