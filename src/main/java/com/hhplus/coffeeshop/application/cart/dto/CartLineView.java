package com.hhplus.coffeeshop.application.cart.dto;

import com.hhplus.coffeeshop.domain.cart.CartLine;
import com.hhplus.coffeeshop.domain.cart.Temperature;
import com.hhplus.coffeeshop.domain.product.CupSize;
import com.hhplus.coffeeshop.domain.product.PriceBreakdown;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 가격이 계산된 장바구니 항목 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartLineView {
    private Long cartLineId;
    private Long productId;
    private String productName;
    private CupSize size;
    private Integer quantity;
    private Integer sugarLevel;
    private Integer iceLevel;
    private Temperature temperature;
    private List<Long> toppingIds;
    private long basePrice;
    private long sizeAdjustment;
    private long toppingCost;
    private long unitPrice;
    private long lineSubtotal;
    /** 상품이 더 이상 판매되지 않아 가격을 산정할 수 없는 경우 false */
    private boolean priced;
    private LocalDateTime createdAt;

    public static CartLineView of(CartLine line, PriceBreakdown price) {
        return CartLineView.builder()
                .cartLineId(line.getCartLineId())
                .productId(line.getProductId())
                .productName(price.getProductName())
                .size(line.getSize())
                .quantity(line.getQuantity())
                .sugarLevel(line.getSugarLevel())
                .iceLevel(line.getIceLevel())
                .temperature(line.getTemperature())
                .toppingIds(new ArrayList<>(line.getToppingIds()))
                .basePrice(price.getBasePrice())
                .sizeAdjustment(price.getSizeAdjustment())
                .toppingCost(price.getToppingCost())
                .unitPrice(price.getTotal())
                .lineSubtotal(price.getTotal() * line.getQuantity())
                .priced(!price.isNotFound())
                .createdAt(line.getCreatedAt())
                .build();
    }
}
