package com.hhplus.coffeeshop.infrastructure.lock;

/**
 * 분산락 키 생성 유틸리티
 *
 * 패턴: resource_type:resource_id
 *
 * 사용 예:
 * - @DistributedLock(key = LockKeyGenerator.CART_KEY_TEMPLATE)
 */
public final class LockKeyGenerator {

    /**
     * 사용자 장바구니 락 키 템플릿 (첫 번째 인자가 userId)
     * 예: addItem(userId=10, ...) → "cart:10"
     *
     * 장바구니 변경과 주문 변환(OrderTransactionService.materialize)이 같은 키를 사용합니다.
     */
    public static final String CART_KEY_TEMPLATE = "'cart:' + #p0";

    private LockKeyGenerator() {
        throw new AssertionError("LockKeyGenerator는 인스턴스화할 수 없습니다");
    }
}
