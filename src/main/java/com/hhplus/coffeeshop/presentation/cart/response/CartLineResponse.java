package com.hhplus.coffeeshop.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 장바구니 항목 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartLineResponse {

    @JsonProperty("cart_line_id")
    private Long cartLineId;

    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("product_name")
    private String productName;

    private String size;

    private Integer quantity;

    @JsonProperty("sugar_level")
    private Integer sugarLevel;

    @JsonProperty("ice_level")
    private Integer iceLevel;

    private String temperature;

    @JsonProperty("topping_ids")
    private List<Long> toppingIds;

    @JsonProperty("base_price")
    private Long basePrice;

    @JsonProperty("size_adjustment")
    private Long sizeAdjustment;

    @JsonProperty("topping_cost")
    private Long toppingCost;

    @JsonProperty("unit_price")
    private Long unitPrice;

    @JsonProperty("line_subtotal")
    private Long lineSubtotal;

    private Boolean available;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;
}
