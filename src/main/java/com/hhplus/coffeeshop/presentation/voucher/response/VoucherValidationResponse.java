package com.hhplus.coffeeshop.presentation.voucher.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 바우처 검증 응답 DTO
 * 사용할 수 없는 바우처도 200으로 응답하며 valid=false와 사유를 담습니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VoucherValidationResponse {

    private String code;

    private Boolean valid;

    @JsonProperty("rejection_code")
    private String rejectionCode;

    private String reason;

    private Long subtotal;

    @JsonProperty("discount_amount")
    private Long discountAmount;

    private VoucherResponse voucher;
}
