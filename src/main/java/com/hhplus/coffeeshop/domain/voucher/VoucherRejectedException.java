package com.hhplus.coffeeshop.domain.voucher;

import com.hhplus.coffeeshop.common.exception.DomainException;
import com.hhplus.coffeeshop.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 바우처 적용 요청이 검증에 실패한 경우 (400)
 *
 * 주문 생성 중의 검증 실패는 할인 0원으로 처리되며 이 예외를 사용하지 않습니다.
 */
@Getter
public class VoucherRejectedException extends DomainException {
    private final VoucherRejection rejection;

    public VoucherRejectedException(String code, VoucherRejection rejection, String reason) {
        super(ErrorCode.VOUCHER_REJECTED, String.format("code=%s, rejection=%s, reason=%s", code, rejection, reason));
        this.rejection = rejection;
    }
}
