package com.hhplus.coffeeshop.application.voucher.dto;

import com.hhplus.coffeeshop.domain.voucher.VoucherRejection;
import com.hhplus.coffeeshop.domain.voucher.VoucherValidationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 바우처 검증 결과 + 예상 할인액
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoucherCheckResult {
    private String code;
    private boolean ok;
    private VoucherRejection rejection;
    private String reason;
    private long subtotal;
    private long discountAmount;
    private VoucherView voucher;

    public static VoucherCheckResult of(String code, long subtotal, VoucherValidationResult result, long discountAmount) {
        return VoucherCheckResult.builder()
                .code(code)
                .ok(result.isOk())
                .rejection(result.getRejection())
                .reason(result.getReason())
                .subtotal(subtotal)
                .discountAmount(result.isOk() ? discountAmount : 0L)
                .voucher(result.getVoucher() != null ? VoucherView.from(result.getVoucher()) : null)
                .build();
    }
}
