package com.hhplus.coffeeshop.application.catalog;

import com.hhplus.coffeeshop.domain.product.CupSize;
import com.hhplus.coffeeshop.domain.product.PriceBreakdown;
import com.hhplus.coffeeshop.domain.product.PriceCalculator;
import org.springframework.stereotype.Service;

import java.util.Collection;

/**
 * PricingService - 단가 계산 조정자
 *
 * 캐시된 카탈로그를 PriceCalculator에 전달합니다.
 * 알 수 없는 상품은 예외 없이 0원 결과(isNotFound)를 반환합니다.
 */
@Service
public class PricingService {

    private final CatalogQueryService catalogQueryService;
    private final PriceCalculator priceCalculator;

    public PricingService(CatalogQueryService catalogQueryService, PriceCalculator priceCalculator) {
        this.catalogQueryService = catalogQueryService;
        this.priceCalculator = priceCalculator;
    }

    public PriceBreakdown quote(Long productId, CupSize size, Collection<Long> toppingIds) {
        return priceCalculator.calculate(
                productId,
                catalogQueryService.findPricing(productId),
                size,
                toppingIds,
                catalogQueryService.findToppingCatalog()
        );
    }
}
