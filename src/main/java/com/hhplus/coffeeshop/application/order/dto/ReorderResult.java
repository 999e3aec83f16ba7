package com.hhplus.coffeeshop.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 재주문 결과 (장바구니에 다시 담긴 항목 수 / 판매 중지로 건너뛴 항목 수)
 */
@Getter
@AllArgsConstructor
public class ReorderResult {
    private final Long orderId;
    private final int addedLines;
    private final int skippedLines;
}
