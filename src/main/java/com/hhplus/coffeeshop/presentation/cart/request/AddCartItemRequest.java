package com.hhplus.coffeeshop.presentation.cart.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 장바구니 항목 추가 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddCartItemRequest {

    @NotNull
    @JsonProperty("product_id")
    private Long productId;

    private String size;

    @NotNull
    private Integer quantity;

    @JsonProperty("sugar_level")
    private Integer sugarLevel;

    @JsonProperty("ice_level")
    private Integer iceLevel;

    private String temperature;

    @JsonProperty("topping_ids")
    private List<Long> toppingIds;
}
