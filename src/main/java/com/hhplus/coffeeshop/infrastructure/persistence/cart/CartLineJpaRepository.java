package com.hhplus.coffeeshop.infrastructure.persistence.cart;

import com.hhplus.coffeeshop.domain.cart.CartLine;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * CartLine JPA Repository
 */
public interface CartLineJpaRepository extends JpaRepository<CartLine, Long> {

    List<CartLine> findByUserIdOrderByCreatedAtDescCartLineIdDesc(Long userId);

    List<CartLine> findByUserIdAndProductId(Long userId, Long productId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM CartLine c WHERE c.userId = :userId")
    int deleteAllByUserId(@Param("userId") Long userId);

    @Query("SELECT COALESCE(SUM(c.quantity), 0) FROM CartLine c WHERE c.userId = :userId")
    Long sumQuantityByUserId(@Param("userId") Long userId);
}
