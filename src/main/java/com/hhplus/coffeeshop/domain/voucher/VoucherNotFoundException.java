package com.hhplus.coffeeshop.domain.voucher;

import com.hhplus.coffeeshop.common.exception.DomainException;
import com.hhplus.coffeeshop.common.exception.ErrorCode;

public class VoucherNotFoundException extends DomainException {

    public VoucherNotFoundException(String code) {
        super(ErrorCode.VOUCHER_NOT_FOUND, String.format("코드: %s", code));
    }
}
