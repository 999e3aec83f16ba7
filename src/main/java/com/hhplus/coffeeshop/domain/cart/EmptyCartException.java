package com.hhplus.coffeeshop.domain.cart;

import com.hhplus.coffeeshop.common.exception.DomainException;
import com.hhplus.coffeeshop.common.exception.ErrorCode;

/**
 * 빈 장바구니로 주문을 생성하려 할 때 발생하는 예외
 */
public class EmptyCartException extends DomainException {

    public EmptyCartException(Long userId) {
        super(ErrorCode.EMPTY_CART, String.format("사용자 ID: %d", userId));
    }
}
