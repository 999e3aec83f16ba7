package com.hhplus.coffeeshop.infrastructure.persistence.product;

import com.hhplus.coffeeshop.domain.product.Product;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Product JPA Repository
 */
public interface ProductJpaRepository extends JpaRepository<Product, Long> {
}
