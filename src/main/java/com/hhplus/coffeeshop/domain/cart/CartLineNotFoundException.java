package com.hhplus.coffeeshop.domain.cart;

import com.hhplus.coffeeshop.common.exception.DomainException;
import com.hhplus.coffeeshop.common.exception.ErrorCode;

/**
 * 장바구니 항목을 찾을 수 없을 때 발생하는 예외
 * 다른 사용자의 항목에 접근한 경우에도 동일하게 응답합니다.
 */
public class CartLineNotFoundException extends DomainException {

    public CartLineNotFoundException(Long cartLineId) {
        super(ErrorCode.CART_ITEM_NOT_FOUND, String.format("ID: %d", cartLineId));
    }
}
