package com.hhplus.coffeeshop.domain.voucher;

/**
 * 바우처 할인 방식
 * - PERCENTAGE: 주문 금액의 비율 (0~100), 최대 할인액 상한 적용 가능
 * - FIXED: 고정 금액
 */
public enum DiscountType {
    PERCENTAGE,
    FIXED
}
