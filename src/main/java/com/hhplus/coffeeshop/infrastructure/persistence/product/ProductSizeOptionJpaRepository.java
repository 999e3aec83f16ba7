package com.hhplus.coffeeshop.infrastructure.persistence.product;

import com.hhplus.coffeeshop.domain.product.ProductSizeOption;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ProductSizeOptionJpaRepository extends JpaRepository<ProductSizeOption, Long> {

    List<ProductSizeOption> findByProductId(Long productId);
}
