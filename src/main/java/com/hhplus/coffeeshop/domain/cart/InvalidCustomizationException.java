package com.hhplus.coffeeshop.domain.cart;

import com.hhplus.coffeeshop.common.exception.DomainException;
import com.hhplus.coffeeshop.common.exception.ErrorCode;

public class InvalidCustomizationException extends DomainException {

    public InvalidCustomizationException(String detail) {
        super(ErrorCode.INVALID_CUSTOMIZATION, detail);
    }
}
