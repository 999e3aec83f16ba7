package com.hhplus.coffeeshop.domain.order;

import com.hhplus.coffeeshop.common.exception.DomainException;
import com.hhplus.coffeeshop.common.exception.ErrorCode;

/**
 * 주문 소유자가 아닌 사용자가 주문을 변경하려 할 때 발생하는 예외 (403)
 */
public class UserMismatchException extends DomainException {

    public UserMismatchException(Long orderId, Long requestingUserId) {
        super(ErrorCode.USER_MISMATCH, String.format("주문 ID: %d, 요청 사용자: %d", orderId, requestingUserId));
    }
}
