package com.hhplus.coffeeshop.domain.order;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 주문 금액 (Value Object)
 *
 * total = subtotal - discountAmount + deliveryFee, total >= 0
 */
@Getter
@EqualsAndHashCode
@ToString
public final class OrderAmounts {
    private final long subtotal;
    private final long discountAmount;
    private final long deliveryFee;
    private final long total;

    private OrderAmounts(long subtotal, long discountAmount, long deliveryFee) {
        this.subtotal = subtotal;
        this.discountAmount = discountAmount;
        this.deliveryFee = deliveryFee;
        this.total = subtotal - discountAmount + deliveryFee;
    }

    public static OrderAmounts of(long subtotal, long discountAmount, long deliveryFee) {
        OrderAmounts amounts = new OrderAmounts(subtotal, discountAmount, deliveryFee);
        amounts.verify();
        return amounts;
    }

    void verify() {
        if (subtotal < 0) {
            throw new IllegalArgumentException("주문 금액은 음수가 될 수 없습니다");
        }
        if (discountAmount < 0 || discountAmount > subtotal) {
            throw new IllegalArgumentException(String.format(
                    "할인액은 0 이상 주문 금액(%d) 이하여야 합니다: %d", subtotal, discountAmount));
        }
        if (deliveryFee < 0) {
            throw new IllegalArgumentException("배달비는 음수가 될 수 없습니다");
        }
        if (total != subtotal - discountAmount + deliveryFee || total < 0) {
            throw new IllegalArgumentException("최종 금액이 유효하지 않습니다: " + total);
        }
    }
}
