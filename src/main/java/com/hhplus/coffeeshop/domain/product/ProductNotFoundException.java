package com.hhplus.coffeeshop.domain.product;

import com.hhplus.coffeeshop.common.exception.DomainException;
import com.hhplus.coffeeshop.common.exception.ErrorCode;

/**
 * 상품을 찾을 수 없거나 가격을 산정할 수 없을 때 발생하는 예외
 */
public class ProductNotFoundException extends DomainException {

    public ProductNotFoundException(Long productId) {
        super(ErrorCode.PRODUCT_NOT_FOUND, String.format("상품 ID: %d", productId));
    }
}
