package com.hhplus.coffeeshop.domain.cart;

import java.util.List;
import java.util.Optional;

/**
 * 장바구니 저장소 포트
 */
public interface CartRepository {

    Optional<CartLine> findById(Long cartLineId);

    /**
     * 사용자의 장바구니 항목 (최근 담은 순)
     */
    List<CartLine> findByUserId(Long userId);

    /**
     * 병합 후보 조회 (같은 사용자, 같은 상품)
     */
    List<CartLine> findByUserIdAndProductId(Long userId, Long productId);

    CartLine save(CartLine cartLine);

    void delete(CartLine cartLine);

    void deleteAllByUserId(Long userId);

    /**
     * 담긴 수량 합계 (항목 수가 아님)
     */
    int sumQuantityByUserId(Long userId);
}
