package com.hhplus.coffeeshop.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class CartCountResponse {

    @JsonProperty("item_count")
    private Integer itemCount;
}
