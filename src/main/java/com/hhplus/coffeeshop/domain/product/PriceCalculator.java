package com.hhplus.coffeeshop.domain.product;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * PriceCalculator - 단가 계산 Domain Service
 *
 * 역할:
 * - 기본가 + 사이즈 조정값 + 토핑 가격 합계로 한 잔의 단가를 계산
 *
 * 특징:
 * - 순수 함수 (외부 의존성 없음, 카탈로그 데이터는 호출자가 전달)
 * - 알 수 없는 상품은 예외 대신 0원 결과를 반환하므로 호출자가 isNotFound()로 분기
 * - 알 수 없는 토핑 ID는 무시
 */
public class PriceCalculator {

    public PriceBreakdown calculate(Long productId,
                                    ProductPricing pricing,
                                    CupSize size,
                                    Collection<Long> toppingIds,
                                    List<ToppingPrice> toppingCatalog) {
        if (pricing == null) {
            return PriceBreakdown.notFound(productId);
        }

        CupSize effectiveSize = size != null ? size : CupSize.M;
        long basePrice = pricing.getBasePrice() != null ? pricing.getBasePrice() : 0L;
        long sizeAdjustment = pricing.adjustmentFor(effectiveSize);

        Map<Long, ToppingPrice> toppingsById = toppingCatalog.stream()
                .collect(Collectors.toMap(ToppingPrice::getToppingId, Function.identity(), (a, b) -> a));

        Set<Long> priced = new TreeSet<>();
        long toppingCost = 0L;
        if (toppingIds != null) {
            for (Long toppingId : toppingIds) {
                ToppingPrice topping = toppingId != null ? toppingsById.get(toppingId) : null;
                if (topping != null && priced.add(toppingId)) {
                    toppingCost += topping.getPrice();
                }
            }
        }

        long total = Math.max(0L, basePrice + sizeAdjustment + toppingCost);

        return PriceBreakdown.builder()
                .productId(productId)
                .productName(pricing.getProductName())
                .basePrice(basePrice)
                .sizeAdjustment(sizeAdjustment)
                .toppingCost(toppingCost)
                .total(total)
                .pricedToppingIds(priced)
                .build();
    }
}
