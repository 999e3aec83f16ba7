package com.hhplus.coffeeshop.application.cart.dto;

import com.hhplus.coffeeshop.domain.order.OrderType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 결제 전 미리보기 (상태 변경 없음)
 *
 * 주문 생성과 동일한 바우처/배달비/준비 시간 정책으로 계산합니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutPreview {
    private CartSummary cart;
    private OrderType orderType;
    private String voucherCode;
    private boolean voucherApplied;
    private String voucherRejectionReason;
    private long discountAmount;
    private long deliveryFee;
    private long totalAmount;
    private LocalDateTime estimatedReadyAt;
}
