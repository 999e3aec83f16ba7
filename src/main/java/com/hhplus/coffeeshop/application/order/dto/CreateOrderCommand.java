package com.hhplus.coffeeshop.application.order.dto;

import com.hhplus.coffeeshop.domain.order.OrderDestination;
import com.hhplus.coffeeshop.domain.order.OrderType;
import com.hhplus.coffeeshop.domain.order.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 주문 생성 커맨드 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderCommand {
    private OrderType orderType;
    private PaymentMethod paymentMethod;
    private Long storeId;
    private String deliveryAddress;
    private String tableNumber;
    private String notes;
    private String voucherCode;

    public OrderDestination destination() {
        return OrderDestination.of(storeId, deliveryAddress, tableNumber);
    }

    public boolean hasVoucherCode() {
        return voucherCode != null && !voucherCode.isBlank();
    }
}
