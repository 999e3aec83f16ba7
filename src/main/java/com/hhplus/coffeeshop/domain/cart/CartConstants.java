package com.hhplus.coffeeshop.domain.cart;

import com.hhplus.coffeeshop.domain.product.CupSize;

/**
 * CartConstants - 장바구니 도메인 상수
 *
 * 최대 수량은 설정값(coffeeshop.cart.max-quantity)으로 관리합니다.
 */
public class CartConstants {

    // ========== Customization Defaults ==========

    public static final CupSize DEFAULT_SIZE = CupSize.M;
    public static final int DEFAULT_SUGAR_LEVEL = 50;
    public static final int DEFAULT_ICE_LEVEL = 50;
    public static final Temperature DEFAULT_TEMPERATURE = Temperature.COLD;

    // ========== Level Range ==========

    public static final int MIN_LEVEL = 0;
    public static final int MAX_LEVEL = 100;

    /** 장바구니 항목 최소 수량 */
    public static final int MIN_CART_QUANTITY = 1;

    private CartConstants() {
        throw new AssertionError("CartConstants는 인스턴스화할 수 없습니다");
    }
}
