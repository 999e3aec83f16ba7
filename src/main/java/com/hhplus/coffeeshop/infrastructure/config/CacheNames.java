package com.hhplus.coffeeshop.infrastructure.config;

import java.time.Duration;

/**
 * 캐시 이름과 TTL
 *
 * 사용: @Cacheable(value = CacheNames.PRODUCT_PRICING, key = "#productId")
 */
public final class CacheNames {

    /** 상품 가격 정보 (기본가 + 사이즈표) */
    public static final String PRODUCT_PRICING = "productPricing";
    public static final Duration PRODUCT_PRICING_TTL = Duration.ofMinutes(10);

    /** 판매 중인 토핑 가격표 */
    public static final String TOPPING_CATALOG = "toppingCatalog";
    public static final Duration TOPPING_CATALOG_TTL = Duration.ofMinutes(10);

    private CacheNames() {
        throw new AssertionError("CacheNames는 인스턴스화할 수 없습니다");
    }
}
