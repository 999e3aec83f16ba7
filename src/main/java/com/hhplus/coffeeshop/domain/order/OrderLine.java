package com.hhplus.coffeeshop.domain.order;

import com.hhplus.coffeeshop.domain.cart.Temperature;
import com.hhplus.coffeeshop.domain.common.ToppingIdsConverter;
import com.hhplus.coffeeshop.domain.product.CupSize;
import jakarta.persistence.*;
import lombok.*;

import java.util.Set;
import java.util.TreeSet;

/**
 * OrderLine 엔티티 - 주문 시점 장바구니 항목의 가격 고정 사본
 *
 * 상품명은 비정규화하여 저장하므로 이후 상품명 변경/삭제와 무관합니다.
 * 주문과 함께 한 번 생성되며 변경되지 않습니다.
 */
@Entity
@Table(name = "order_lines")
@Getter
@Builder(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderLine {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_line_id")
    private Long orderLineId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "product_name", nullable = false)
    private String productName;

    @Column(name = "cup_size", nullable = false, length = 1)
    @Enumerated(EnumType.STRING)
    private CupSize size;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "unit_price", nullable = false)
    private Long unitPrice;

    @Column(name = "sugar_level", nullable = false)
    private Integer sugarLevel;

    @Column(name = "ice_level", nullable = false)
    private Integer iceLevel;

    @Column(name = "temperature", nullable = false, length = 10)
    @Enumerated(EnumType.STRING)
    private Temperature temperature;

    @Convert(converter = ToppingIdsConverter.class)
    @Column(name = "topping_ids", nullable = false)
    private Set<Long> toppingIds;

    @Column(name = "topping_cost", nullable = false)
    private Long toppingCost;

    @Column(name = "line_subtotal", nullable = false)
    private Long lineSubtotal;

    /**
     * 주문 항목 생성 팩토리 메서드
     *
     * @throws IllegalArgumentException 수량 또는 가격이 유효하지 않은 경우
     */
    public static OrderLine of(Long productId, String productName, CupSize size, int quantity,
                               long unitPrice, int sugarLevel, int iceLevel, Temperature temperature,
                               Set<Long> toppingIds, long toppingCost) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("주문 수량은 1 이상이어야 합니다");
        }
        if (unitPrice < 0 || toppingCost < 0) {
            throw new IllegalArgumentException("가격은 음수가 될 수 없습니다");
        }
        return OrderLine.builder()
                .productId(productId)
                .productName(productName)
                .size(size)
                .quantity(quantity)
                .unitPrice(unitPrice)
                .sugarLevel(sugarLevel)
                .iceLevel(iceLevel)
                .temperature(temperature)
                .toppingIds(toppingIds == null ? new TreeSet<>() : new TreeSet<>(toppingIds))
                .toppingCost(toppingCost)
                .lineSubtotal(unitPrice * quantity)
                .build();
    }
}
