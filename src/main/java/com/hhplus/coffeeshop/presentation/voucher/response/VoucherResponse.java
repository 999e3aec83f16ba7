package com.hhplus.coffeeshop.presentation.voucher.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 바우처 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoucherResponse {

    @JsonProperty("voucher_id")
    private Long voucherId;

    private String code;

    private String description;

    @JsonProperty("discount_type")
    private String discountType;

    @JsonProperty("discount_value")
    private BigDecimal discountValue;

    @JsonProperty("min_order_amount")
    private Long minOrderAmount;

    @JsonProperty("max_discount_amount")
    private Long maxDiscountAmount;

    @JsonProperty("usage_limit")
    private Integer usageLimit;

    @JsonProperty("usage_per_user")
    private Integer usagePerUser;

    @JsonProperty("current_usage")
    private Integer currentUsage;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("starts_at")
    private LocalDateTime startsAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("ends_at")
    private LocalDateTime endsAt;
}
