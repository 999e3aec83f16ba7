package com.hhplus.coffeeshop.application.catalog;

import com.hhplus.coffeeshop.domain.product.CatalogRepository;
import com.hhplus.coffeeshop.domain.product.Product;
import com.hhplus.coffeeshop.domain.product.ProductPricing;
import com.hhplus.coffeeshop.domain.product.ToppingPrice;
import com.hhplus.coffeeshop.infrastructure.config.CacheNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * 카탈로그 조회 서비스 (캐시 적용)
 *
 * 가격 계산에 필요한 상품 가격표와 토핑 가격표를 Redis에 캐시합니다.
 * 판매 중지된 상품이나 존재하지 않는 상품은 null을 반환하며 캐시하지 않습니다.
 */
@Slf4j
@Service
public class CatalogQueryService {

    private final CatalogRepository catalogRepository;

    public CatalogQueryService(CatalogRepository catalogRepository) {
        this.catalogRepository = catalogRepository;
    }

    @Cacheable(value = CacheNames.PRODUCT_PRICING, key = "#productId", unless = "#result == null")
    @Transactional(readOnly = true)
    public ProductPricing findPricing(Long productId) {
        if (productId == null) {
            return null;
        }
        log.debug("[CatalogQueryService] 상품 가격표 DB 조회 - productId={}", productId);
        return catalogRepository.findProductById(productId)
                .filter(Product::isOrderable)
                .map(product -> ProductPricing.of(product, catalogRepository.findSizeOptions(productId)))
                .orElse(null);
    }

    @Cacheable(value = CacheNames.TOPPING_CATALOG, key = "'all'")
    @Transactional(readOnly = true)
    public List<ToppingPrice> findToppingCatalog() {
        log.debug("[CatalogQueryService] 토핑 가격표 DB 조회");
        List<ToppingPrice> toppings = new ArrayList<>();
        catalogRepository.findAvailableToppings().forEach(topping -> toppings.add(ToppingPrice.from(topping)));
        return toppings;
    }
}
