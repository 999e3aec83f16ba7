package com.hhplus.coffeeshop.application.voucher.dto;

import com.hhplus.coffeeshop.domain.voucher.DiscountType;
import com.hhplus.coffeeshop.domain.voucher.Voucher;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoucherView {
    private Long voucherId;
    private String code;
    private String description;
    private DiscountType discountType;
    private BigDecimal discountValue;
    private Long minOrderAmount;
    private Long maxDiscountAmount;
    private Integer usageLimit;
    private Integer usagePerUser;
    private Integer currentUsage;
    private LocalDateTime startsAt;
    private LocalDateTime endsAt;

    public static VoucherView from(Voucher voucher) {
        return VoucherView.builder()
                .voucherId(voucher.getVoucherId())
                .code(voucher.getCode())
                .description(voucher.getDescription())
                .discountType(voucher.getDiscountType())
                .discountValue(voucher.getDiscountValue())
                .minOrderAmount(voucher.getMinOrderAmount())
                .maxDiscountAmount(voucher.getMaxDiscountAmount())
                .usageLimit(voucher.getUsageLimit())
                .usagePerUser(voucher.getUsagePerUser())
                .currentUsage(voucher.getCurrentUsage())
                .startsAt(voucher.getStartsAt())
                .endsAt(voucher.getEndsAt())
                .build();
    }
}
