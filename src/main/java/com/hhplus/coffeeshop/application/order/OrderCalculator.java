package com.hhplus.coffeeshop.application.order;

import com.hhplus.coffeeshop.application.cart.dto.CartLineView;
import com.hhplus.coffeeshop.application.cart.dto.CartSummary;
import com.hhplus.coffeeshop.domain.order.DeliveryFeePolicy;
import com.hhplus.coffeeshop.domain.order.OrderAmounts;
import com.hhplus.coffeeshop.domain.order.OrderLine;
import com.hhplus.coffeeshop.domain.order.OrderType;
import com.hhplus.coffeeshop.domain.product.ProductNotFoundException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * OrderCalculator - 주문 금액 계산 전담
 *
 * 주문 항목 가격은 장바구니 요약 시점의 값으로 고정되며 이후 다시 계산하지 않습니다.
 * total = subtotal - discount + deliveryFee
 */
@Component
public class OrderCalculator {

    private final DeliveryFeePolicy deliveryFeePolicy;

    public OrderCalculator(DeliveryFeePolicy deliveryFeePolicy) {
        this.deliveryFeePolicy = deliveryFeePolicy;
    }

    /**
     * 장바구니 항목 → 가격이 고정된 주문 항목
     *
     * @throws ProductNotFoundException 더 이상 가격을 산정할 수 없는 상품이 담긴 경우
     */
    public List<OrderLine> toOrderLines(CartSummary cart) {
        return cart.getLines().stream()
                .map(this::toOrderLine)
                .collect(Collectors.toList());
    }

    public OrderAmounts calculateAmounts(long subtotal, long discountAmount, OrderType orderType) {
        long deliveryFee = deliveryFeePolicy.feeFor(orderType, subtotal);
        return OrderAmounts.of(subtotal, discountAmount, deliveryFee);
    }

    private OrderLine toOrderLine(CartLineView line) {
        if (!line.isPriced()) {
            throw new ProductNotFoundException(line.getProductId());
        }
        return OrderLine.of(
                line.getProductId(),
                line.getProductName(),
                line.getSize(),
                line.getQuantity(),
                line.getUnitPrice(),
                line.getSugarLevel(),
                line.getIceLevel(),
                line.getTemperature(),
                new TreeSet<>(line.getToppingIds()),
                line.getToppingCost()
        );
    }
}
