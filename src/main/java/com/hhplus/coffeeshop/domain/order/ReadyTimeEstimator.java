package com.hhplus.coffeeshop.domain.order;

import java.time.LocalDateTime;

/**
 * 예상 준비 완료 시각 계산
 *
 * now + 기본 준비 시간 + (총 수량 × 잔당 시간) + 주문 유형별 추가 시간
 */
public class ReadyTimeEstimator {

    private final int basePrepMinutes;
    private final int perItemMinutes;
    private final int pickupOffsetMinutes;
    private final int deliveryOffsetMinutes;
    private final int dineInOffsetMinutes;

    public ReadyTimeEstimator(int basePrepMinutes, int perItemMinutes,
                              int pickupOffsetMinutes, int deliveryOffsetMinutes, int dineInOffsetMinutes) {
        this.basePrepMinutes = basePrepMinutes;
        this.perItemMinutes = perItemMinutes;
        this.pickupOffsetMinutes = pickupOffsetMinutes;
        this.deliveryOffsetMinutes = deliveryOffsetMinutes;
        this.dineInOffsetMinutes = dineInOffsetMinutes;
    }

    public LocalDateTime estimate(OrderType orderType, int itemCount, LocalDateTime now) {
        long minutes = (long) basePrepMinutes + (long) itemCount * perItemMinutes + offsetFor(orderType);
        return now.plusMinutes(minutes);
    }

    private int offsetFor(OrderType orderType) {
        switch (orderType) {
            case PICKUP:
                return pickupOffsetMinutes;
            case DELIVERY:
                return deliveryOffsetMinutes;
            default:
                return dineInOffsetMinutes;
        }
    }
}
