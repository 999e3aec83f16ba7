package com.hhplus.coffeeshop.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 결제 전 미리보기 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutPreviewResponse {

    private CartResponse cart;

    @JsonProperty("order_type")
    private String orderType;

    @JsonProperty("voucher_code")
    private String voucherCode;

    @JsonProperty("voucher_applied")
    private Boolean voucherApplied;

    @JsonProperty("voucher_rejection_reason")
    private String voucherRejectionReason;

    private Long subtotal;

    @JsonProperty("discount_amount")
    private Long discountAmount;

    @JsonProperty("delivery_fee")
    private Long deliveryFee;

    @JsonProperty("total_amount")
    private Long totalAmount;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("estimated_ready_at")
    private LocalDateTime estimatedReadyAt;
}
