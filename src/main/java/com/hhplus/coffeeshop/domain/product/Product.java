package com.hhplus.coffeeshop.domain.product;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Product 엔티티 (읽기 전용 카탈로그)
 *
 * 주문 엔진은 상품을 수정하지 않고 가격 계산의 기준으로만 사용합니다.
 */
@Entity
@Table(name = "products")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "product_id")
    private Long productId;

    @Column(name = "product_name", nullable = false)
    private String productName;

    @Column(name = "base_price", nullable = false)
    private Long basePrice;

    @Column(name = "is_available", nullable = false)
    @Builder.Default
    private Boolean isAvailable = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    public boolean isOrderable() {
        return Boolean.TRUE.equals(isAvailable);
    }
}
