package com.hhplus.coffeeshop.application.cart.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 장바구니 요약
 *
 * itemCount는 항목 수가 아닌 수량 합계입니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartSummary {
    private Long userId;
    private List<CartLineView> lines;
    private long subtotal;
    private int itemCount;

    public boolean isEmpty() {
        return lines == null || lines.isEmpty();
    }

    public int getLineCount() {
        return lines == null ? 0 : lines.size();
    }
}
