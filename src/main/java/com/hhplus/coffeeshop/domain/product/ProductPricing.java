package com.hhplus.coffeeshop.domain.product;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 가격 계산에 필요한 상품 정보 스냅샷
 *
 * Redis 캐시(productPricing)에 저장되므로 기본 생성자와 가변 컬렉션을 사용합니다.
 * sizeAdjustments가 비어 있으면 CupSize의 기본 가격 조정값을 사용합니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductPricing {
    private Long productId;
    private String productName;
    private Long basePrice;

    @Builder.Default
    private Map<CupSize, Long> sizeAdjustments = new HashMap<>();

    public static ProductPricing of(Product product, List<ProductSizeOption> sizeOptions) {
        Map<CupSize, Long> adjustments = new HashMap<>();
        for (ProductSizeOption option : sizeOptions) {
            adjustments.put(option.getCupSize(), option.getPriceAdjustment());
        }
        return ProductPricing.builder()
                .productId(product.getProductId())
                .productName(product.getProductName())
                .basePrice(product.getBasePrice())
                .sizeAdjustments(adjustments)
                .build();
    }

    /**
     * 사이즈 가격 조정값
     *
     * 상품에 사이즈표가 정의되어 있으면 해당 값(미정의 사이즈는 0),
     * 사이즈표가 없으면 기본 스케줄을 적용합니다.
     */
    public long adjustmentFor(CupSize size) {
        if (sizeAdjustments == null || sizeAdjustments.isEmpty()) {
            return size.getDefaultAdjustment();
        }
        return sizeAdjustments.getOrDefault(size, 0L);
    }
}
