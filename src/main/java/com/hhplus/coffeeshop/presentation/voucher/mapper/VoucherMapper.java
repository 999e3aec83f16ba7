package com.hhplus.coffeeshop.presentation.voucher.mapper;

import com.hhplus.coffeeshop.application.voucher.dto.VoucherCheckResult;
import com.hhplus.coffeeshop.application.voucher.dto.VoucherView;
import com.hhplus.coffeeshop.presentation.voucher.response.VoucherResponse;
import com.hhplus.coffeeshop.presentation.voucher.response.VoucherValidationResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * VoucherMapper - Application DTO → Presentation Response 변환
 */
@Component
public class VoucherMapper {

    public VoucherResponse toVoucherResponse(VoucherView view) {
        return VoucherResponse.builder()
                .voucherId(view.getVoucherId())
                .code(view.getCode())
                .description(view.getDescription())
                .discountType(view.getDiscountType().name())
                .discountValue(view.getDiscountValue())
                .minOrderAmount(view.getMinOrderAmount())
                .maxDiscountAmount(view.getMaxDiscountAmount())
                .usageLimit(view.getUsageLimit())
                .usagePerUser(view.getUsagePerUser())
                .currentUsage(view.getCurrentUsage())
                .startsAt(view.getStartsAt())
                .endsAt(view.getEndsAt())
                .build();
    }

    public List<VoucherResponse> toVoucherResponses(List<VoucherView> views) {
        return views.stream()
                .map(this::toVoucherResponse)
                .collect(Collectors.toList());
    }

    public VoucherValidationResponse toValidationResponse(VoucherCheckResult result) {
        return VoucherValidationResponse.builder()
                .code(result.getCode())
                .valid(result.isOk())
                .rejectionCode(result.getRejection() != null ? result.getRejection().name() : null)
                .reason(result.getReason())
                .subtotal(result.getSubtotal())
                .discountAmount(result.getDiscountAmount())
                .voucher(result.getVoucher() != null ? toVoucherResponse(result.getVoucher()) : null)
                .build();
    }
}
