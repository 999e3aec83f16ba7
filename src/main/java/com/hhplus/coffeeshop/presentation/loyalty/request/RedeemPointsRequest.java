package com.hhplus.coffeeshop.presentation.loyalty.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RedeemPointsRequest {

    @NotNull
    @Positive
    private Long points;

    @Size(max = 255)
    private String description;
}
