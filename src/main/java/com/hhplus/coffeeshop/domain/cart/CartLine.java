package com.hhplus.coffeeshop.domain.cart;

import com.hhplus.coffeeshop.domain.common.ToppingIdsConverter;
import com.hhplus.coffeeshop.domain.product.CupSize;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * CartLine 도메인 엔티티
 *
 * 책임:
 * - 사용자별, 옵션 조합별 장바구니 항목 관리
 * - 동일 옵션 조합 판별 (병합 기준)
 *
 * 핵심 비즈니스 규칙:
 * - 병합 식별자 = (user, product, size, sugar, ice, temperature, topping set)
 * - 저장된 항목의 수량은 항상 1 이상 (0 이하로 변경되면 삭제)
 */
@Entity
@Table(name = "cart_lines",
        indexes = @Index(name = "idx_cart_lines_user_product", columnList = "user_id, product_id"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartLine {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cart_line_id")
    private Long cartLineId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "cup_size", nullable = false, length = 1)
    @Enumerated(EnumType.STRING)
    private CupSize size;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "sugar_level", nullable = false)
    private Integer sugarLevel;

    @Column(name = "ice_level", nullable = false)
    private Integer iceLevel;

    @Column(name = "temperature", nullable = false, length = 10)
    @Enumerated(EnumType.STRING)
    private Temperature temperature;

    @Convert(converter = ToppingIdsConverter.class)
    @Column(name = "topping_ids", nullable = false)
    @Builder.Default
    private Set<Long> toppingIds = new TreeSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 장바구니 항목 생성 팩토리 메서드
     */
    public static CartLine create(Long userId, Long productId, CartCustomization customization, int quantity) {
        if (quantity < CartConstants.MIN_CART_QUANTITY) {
            throw new IllegalArgumentException("수량은 1 이상이어야 합니다");
        }
        LocalDateTime now = LocalDateTime.now();
        return CartLine.builder()
                .userId(userId)
                .productId(productId)
                .size(customization.getSize())
                .quantity(quantity)
                .sugarLevel(customization.getSugarLevel())
                .iceLevel(customization.getIceLevel())
                .temperature(customization.getTemperature())
                .toppingIds(new TreeSet<>(customization.getToppingIds()))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 동일 옵션 조합 여부 (사용자 + 상품 + 옵션)
     */
    public boolean hasSameIdentity(Long userId, Long productId, CartCustomization customization) {
        return Objects.equals(this.userId, userId)
                && Objects.equals(this.productId, productId)
                && customization().equals(customization);
    }

    public boolean isOwnedBy(Long userId) {
        return Objects.equals(this.userId, userId);
    }

    public CartCustomization customization() {
        return CartCustomization.of(size, sugarLevel, iceLevel, temperature, toppingIds);
    }

    /**
     * 동일 옵션 재담기 시 수량 누적
     */
    public void increaseQuantity(int amount) {
        if (amount < CartConstants.MIN_CART_QUANTITY) {
            throw new IllegalArgumentException("추가 수량은 1 이상이어야 합니다");
        }
        this.quantity += amount;
        this.updatedAt = LocalDateTime.now();
    }

    public void changeQuantity(int quantity) {
        if (quantity < CartConstants.MIN_CART_QUANTITY) {
            throw new IllegalArgumentException("수량은 1 이상이어야 합니다 (0 이하는 항목 삭제)");
        }
        this.quantity = quantity;
        this.updatedAt = LocalDateTime.now();
    }

    public void changeCustomization(CartCustomization customization) {
        this.size = customization.getSize();
        this.sugarLevel = customization.getSugarLevel();
        this.iceLevel = customization.getIceLevel();
        this.temperature = customization.getTemperature();
        this.toppingIds = new TreeSet<>(customization.getToppingIds());
        this.updatedAt = LocalDateTime.now();
    }
}
