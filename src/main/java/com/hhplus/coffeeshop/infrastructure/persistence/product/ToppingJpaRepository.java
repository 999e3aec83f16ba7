package com.hhplus.coffeeshop.infrastructure.persistence.product;

import com.hhplus.coffeeshop.domain.product.Topping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface ToppingJpaRepository extends JpaRepository<Topping, Long> {

    /**
     * 판매 중인 토핑 조회 (ID 오름차순)
     */
    @Query("SELECT t FROM Topping t WHERE t.isAvailable = true ORDER BY t.toppingId ASC")
    List<Topping> findAvailable();
}
