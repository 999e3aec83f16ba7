package com.hhplus.coffeeshop.presentation.cart.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 장바구니 항목 부분 수정 요청 DTO
 * 생략된(null) 필드는 변경하지 않습니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateCartItemRequest {

    private String size;

    private Integer quantity;

    @JsonProperty("sugar_level")
    private Integer sugarLevel;

    @JsonProperty("ice_level")
    private Integer iceLevel;

    private String temperature;

    @JsonProperty("topping_ids")
    private List<Long> toppingIds;
}
