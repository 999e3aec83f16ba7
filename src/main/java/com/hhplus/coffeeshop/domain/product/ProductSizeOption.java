package com.hhplus.coffeeshop.domain.product;

import jakarta.persistence.*;
import lombok.*;

/**
 * 상품별 사이즈 가격 조정값
 * (product_id, cup_size)는 유일합니다.
 */
@Entity
@Table(name = "product_sizes",
        uniqueConstraints = @UniqueConstraint(name = "uk_product_size", columnNames = {"product_id", "cup_size"}))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductSizeOption {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "product_size_id")
    private Long productSizeId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "cup_size", nullable = false, length = 1)
    @Enumerated(EnumType.STRING)
    private CupSize cupSize;

    @Column(name = "price_adjustment", nullable = false)
    private Long priceAdjustment;
}
