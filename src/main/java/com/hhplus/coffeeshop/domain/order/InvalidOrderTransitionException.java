package com.hhplus.coffeeshop.domain.order;

import com.hhplus.coffeeshop.common.exception.DomainException;
import com.hhplus.coffeeshop.common.exception.ErrorCode;

/**
 * 허용되지 않은 주문 상태 전환 시 발생하는 예외 (409)
 * 알 수 없는 상태 값으로 변경을 시도한 경우도 포함합니다.
 */
public class InvalidOrderTransitionException extends DomainException {

    public InvalidOrderTransitionException(Long orderId, OrderStatus current, OrderStatus requested) {
        super(ErrorCode.INVALID_ORDER_TRANSITION,
                String.format("주문 ID: %d, %s → %s", orderId, current, requested));
    }

    public InvalidOrderTransitionException(Long orderId, String requested) {
        super(ErrorCode.INVALID_ORDER_TRANSITION,
                String.format("주문 ID: %d, 알 수 없는 상태: %s", orderId, requested));
    }
}
