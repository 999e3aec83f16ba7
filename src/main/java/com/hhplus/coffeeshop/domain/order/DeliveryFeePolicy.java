package com.hhplus.coffeeshop.domain.order;

/**
 * DeliveryFeePolicy - 배달비 계산 Domain Service
 *
 * 규칙:
 * - 배달 주문이 아니면 0
 * - 주문 금액이 무료 배송 기준 이상이면 0
 * - 그 외: 기본 배달비 + 거리 구간 추가금 (3km 이하 0, 5km 이하 10000, 10km 이하 20000, 초과 30000)
 *
 * 배송 경로 계산은 하지 않으므로 거리는 설정된 기본 거리를 사용합니다.
 */
public class DeliveryFeePolicy {

    private final long freeShippingThreshold;
    private final long baseFee;
    private final int defaultDistanceKm;

    public DeliveryFeePolicy(long freeShippingThreshold, long baseFee, int defaultDistanceKm) {
        this.freeShippingThreshold = freeShippingThreshold;
        this.baseFee = baseFee;
        this.defaultDistanceKm = defaultDistanceKm;
    }

    public long feeFor(OrderType orderType, long subtotal) {
        return feeFor(orderType, subtotal, defaultDistanceKm);
    }

    public long feeFor(OrderType orderType, long subtotal, double distanceKm) {
        if (orderType != OrderType.DELIVERY) {
            return 0L;
        }
        if (subtotal >= freeShippingThreshold) {
            return 0L;
        }
        return baseFee + distanceSurcharge(distanceKm);
    }

    private long distanceSurcharge(double distanceKm) {
        if (distanceKm <= 3) {
            return 0L;
        }
        if (distanceKm <= 5) {
            return 10_000L;
        }
        if (distanceKm <= 10) {
            return 20_000L;
        }
        return 30_000L;
    }
}
