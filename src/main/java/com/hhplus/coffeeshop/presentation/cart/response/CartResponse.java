package com.hhplus.coffeeshop.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 장바구니 조회 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponse {

    @JsonProperty("user_id")
    private Long userId;

    private List<CartLineResponse> lines;

    private Long subtotal;

    @JsonProperty("item_count")
    private Integer itemCount;

    @JsonProperty("line_count")
    private Integer lineCount;
}
