package com.hhplus.coffeeshop.domain.product;

import java.util.List;
import java.util.Optional;

/**
 * 카탈로그 조회 포트 (읽기 전용)
 */
public interface CatalogRepository {

    Optional<Product> findProductById(Long productId);

    List<ProductSizeOption> findSizeOptions(Long productId);

    List<Topping> findAvailableToppings();
}
