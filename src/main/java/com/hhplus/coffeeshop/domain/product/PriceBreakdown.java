package com.hhplus.coffeeshop.domain.product;

import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 단가 계산 결과 (Value Object)
 *
 * total = basePrice + sizeAdjustment + toppingCost (0 미만이면 0)
 * 알 수 없는 상품은 모든 값이 0인 결과로 표현됩니다.
 */
@Getter
@Builder
public class PriceBreakdown {
    private final Long productId;
    private final String productName;
    private final long basePrice;
    private final long sizeAdjustment;
    private final long toppingCost;
    private final long total;

    /** 가격이 산정된(카탈로그에 존재하는) 토핑 ID */
    private final Set<Long> pricedToppingIds;

    public static PriceBreakdown notFound(Long productId) {
        return PriceBreakdown.builder()
                .productId(productId)
                .productName(null)
                .basePrice(0L)
                .sizeAdjustment(0L)
                .toppingCost(0L)
                .total(0L)
                .pricedToppingIds(Collections.emptySet())
                .build();
    }

    public boolean isNotFound() {
        return basePrice == 0L && sizeAdjustment == 0L && toppingCost == 0L && total == 0L;
    }

    public Set<Long> getPricedToppingIds() {
        return pricedToppingIds == null ? Collections.emptySet() : Collections.unmodifiableSet(new TreeSet<>(pricedToppingIds));
    }
}
