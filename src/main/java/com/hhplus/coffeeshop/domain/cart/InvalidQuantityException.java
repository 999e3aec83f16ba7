package com.hhplus.coffeeshop.domain.cart;

import com.hhplus.coffeeshop.common.exception.DomainException;
import com.hhplus.coffeeshop.common.exception.ErrorCode;

/**
 * 수량이 허용 범위(1~최대 수량)를 벗어났을 때 발생하는 예외
 */
public class InvalidQuantityException extends DomainException {

    public InvalidQuantityException(Integer quantity, int maxQuantity) {
        super(ErrorCode.CART_INVALID_QUANTITY,
                String.format("수량은 %d 이상 %d 이하여야 합니다: %s", CartConstants.MIN_CART_QUANTITY, maxQuantity, quantity));
    }
}
