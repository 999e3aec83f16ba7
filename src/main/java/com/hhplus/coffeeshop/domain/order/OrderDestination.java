package com.hhplus.coffeeshop.domain.order;

import lombok.Getter;

/**
 * 주문 유형별 수령 정보 (매장 / 배송지 / 테이블)
 */
@Getter
public final class OrderDestination {
    private final Long storeId;
    private final String deliveryAddress;
    private final String tableNumber;

    private OrderDestination(Long storeId, String deliveryAddress, String tableNumber) {
        this.storeId = storeId;
        this.deliveryAddress = deliveryAddress;
        this.tableNumber = tableNumber;
    }

    public static OrderDestination of(Long storeId, String deliveryAddress, String tableNumber) {
        return new OrderDestination(storeId, blankToNull(deliveryAddress), blankToNull(tableNumber));
    }

    /**
     * 주문 유형에 필요한 항목이 있는지 검증
     *
     * @throws MissingRequiredFieldException 필수 항목 누락
     */
    public void validateFor(OrderType orderType) {
        switch (orderType) {
            case PICKUP:
                if (storeId == null) {
                    throw new MissingRequiredFieldException(orderType, "store_id");
                }
                break;
            case DELIVERY:
                if (deliveryAddress == null) {
                    throw new MissingRequiredFieldException(orderType, "delivery_address");
                }
                break;
            case DINE_IN:
                if (tableNumber == null) {
                    throw new MissingRequiredFieldException(orderType, "table_number");
                }
                break;
            default:
                throw new IllegalStateException("알 수 없는 주문 유형: " + orderType);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
