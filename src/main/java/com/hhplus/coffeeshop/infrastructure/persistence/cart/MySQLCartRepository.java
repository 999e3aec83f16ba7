package com.hhplus.coffeeshop.infrastructure.persistence.cart;

import com.hhplus.coffeeshop.domain.cart.CartLine;
import com.hhplus.coffeeshop.domain.cart.CartRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 장바구니 Repository 구현
 *
 * 장바구니는 사용자별 CartLine 목록이며, 별도의 Cart 헤더 테이블을 두지 않습니다.
 */
@Repository
@Primary
@Transactional
public class MySQLCartRepository implements CartRepository {

    private final CartLineJpaRepository cartLineJpaRepository;

    public MySQLCartRepository(CartLineJpaRepository cartLineJpaRepository) {
        this.cartLineJpaRepository = cartLineJpaRepository;
    }

    @Override
    public Optional<CartLine> findById(Long cartLineId) {
        return cartLineJpaRepository.findById(cartLineId);
    }

    @Override
    public List<CartLine> findByUserId(Long userId) {
        return cartLineJpaRepository.findByUserIdOrderByCreatedAtDescCartLineIdDesc(userId);
    }

    @Override
    public List<CartLine> findByUserIdAndProductId(Long userId, Long productId) {
        return cartLineJpaRepository.findByUserIdAndProductId(userId, productId);
    }

    @Override
    public CartLine save(CartLine cartLine) {
        return cartLineJpaRepository.save(cartLine);
    }

    @Override
    public void delete(CartLine cartLine) {
        cartLineJpaRepository.delete(cartLine);
    }

    @Override
    public void deleteAllByUserId(Long userId) {
        cartLineJpaRepository.deleteAllByUserId(userId);
    }

    @Override
    public int sumQuantityByUserId(Long userId) {
        Long sum = cartLineJpaRepository.sumQuantityByUserId(userId);
        return sum != null ? sum.intValue() : 0;
    }
}
