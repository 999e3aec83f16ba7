package com.hhplus.coffeeshop.domain.voucher;

import lombok.Getter;

/**
 * 바우처 검증 실패 사유 (검증 순서대로 정의)
 */
@Getter
public enum VoucherRejection {
    NOT_FOUND("존재하지 않는 바우처 코드입니다"),
    INACTIVE("사용 기간이 아니거나 비활성화된 바우처입니다"),
    BELOW_MIN_ORDER("최소 주문 금액을 충족하지 못했습니다"),
    USAGE_LIMIT_REACHED("바우처 사용 가능 수량이 모두 소진되었습니다"),
    USER_LIMIT_REACHED("이 바우처의 사용 가능 횟수를 모두 사용했습니다");

    private final String message;

    VoucherRejection(String message) {
        this.message = message;
    }
}
