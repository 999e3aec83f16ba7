package com.hhplus.coffeeshop.infrastructure.persistence.product;

import com.hhplus.coffeeshop.domain.product.CatalogRepository;
import com.hhplus.coffeeshop.domain.product.Product;
import com.hhplus.coffeeshop.domain.product.ProductSizeOption;
import com.hhplus.coffeeshop.domain.product.Topping;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 카탈로그 Repository 구현
 *
 * 카탈로그(상품, 사이즈표, 토핑)는 주문 엔진에서 읽기 전용으로만 사용합니다.
 */
@Repository
@Primary
@Transactional(readOnly = true)
public class MySQLCatalogRepository implements CatalogRepository {

    private final ProductJpaRepository productJpaRepository;
    private final ProductSizeOptionJpaRepository sizeOptionJpaRepository;
    private final ToppingJpaRepository toppingJpaRepository;

    public MySQLCatalogRepository(ProductJpaRepository productJpaRepository,
                                  ProductSizeOptionJpaRepository sizeOptionJpaRepository,
                                  ToppingJpaRepository toppingJpaRepository) {
        this.productJpaRepository = productJpaRepository;
        this.sizeOptionJpaRepository = sizeOptionJpaRepository;
        this.toppingJpaRepository = toppingJpaRepository;
    }

    @Override
    public Optional<Product> findProductById(Long productId) {
        return productJpaRepository.findById(productId);
    }

    @Override
    public List<ProductSizeOption> findSizeOptions(Long productId) {
        return sizeOptionJpaRepository.findByProductId(productId);
    }

    @Override
    public List<Topping> findAvailableToppings() {
        return toppingJpaRepository.findAvailable();
    }
}
