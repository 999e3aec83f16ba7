package com.hhplus.coffeeshop.domain.voucher;

import lombok.Getter;

/**
 * 바우처 검증 결과 {ok, reason, voucher}
 *
 * 검증 실패는 예외가 아닌 값으로 표현됩니다.
 */
@Getter
public class VoucherValidationResult {
    private final boolean ok;
    private final VoucherRejection rejection;
    private final String reason;
    private final Voucher voucher;

    private VoucherValidationResult(boolean ok, VoucherRejection rejection, String reason, Voucher voucher) {
        this.ok = ok;
        this.rejection = rejection;
        this.reason = reason;
        this.voucher = voucher;
    }

    public static VoucherValidationResult accepted(Voucher voucher) {
        return new VoucherValidationResult(true, null, null, voucher);
    }

    public static VoucherValidationResult rejected(VoucherRejection rejection, Voucher voucher) {
        return new VoucherValidationResult(false, rejection, rejection.getMessage(), voucher);
    }

    public static VoucherValidationResult rejected(VoucherRejection rejection, String reason, Voucher voucher) {
        return new VoucherValidationResult(false, rejection, reason, voucher);
    }
}
