package com.hhplus.coffeeshop.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 주문 항목 응답 DTO (주문 시점 가격)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineResponse {

    @JsonProperty("order_line_id")
    private Long orderLineId;

    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("product_name")
    private String productName;

    private String size;

    private Integer quantity;

    @JsonProperty("unit_price")
    private Long unitPrice;

    @JsonProperty("sugar_level")
    private Integer sugarLevel;

    @JsonProperty("ice_level")
    private Integer iceLevel;

    private String temperature;

    @JsonProperty("topping_ids")
    private List<Long> toppingIds;

    @JsonProperty("topping_cost")
    private Long toppingCost;

    @JsonProperty("line_subtotal")
    private Long lineSubtotal;
}
