package com.hhplus.coffeeshop.domain.order;

import com.hhplus.coffeeshop.common.exception.DomainException;
import com.hhplus.coffeeshop.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 주문 유형별 필수 항목 누락 예외 (400)
 * - PICKUP: store_id / DELIVERY: delivery_address / DINE_IN: table_number
 */
@Getter
public class MissingRequiredFieldException extends DomainException {
    private final String field;

    public MissingRequiredFieldException(OrderType orderType, String field) {
        super(ErrorCode.MISSING_REQUIRED_FIELD, String.format("%s 주문에는 %s가 필요합니다", orderType, field));
        this.field = field;
    }
}
