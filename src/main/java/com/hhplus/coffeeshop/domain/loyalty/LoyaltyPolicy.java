package com.hhplus.coffeeshop.domain.loyalty;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * LoyaltyPolicy - 포인트 적립률과 등급 기준 Domain Service
 *
 * - 적립 포인트 = floor(결제 금액 × 적립률), 기본 적립률 0.01
 * - 등급은 잔액만으로 결정되는 순수 함수 (Bronze 0+, Silver 1000+, Gold 5000+)
 */
public class LoyaltyPolicy {

    private final BigDecimal pointsRate;
    private final long silverThreshold;
    private final long goldThreshold;

    public LoyaltyPolicy(BigDecimal pointsRate, long silverThreshold, long goldThreshold) {
        if (pointsRate == null || pointsRate.signum() < 0) {
            throw new IllegalArgumentException("적립률은 0 이상이어야 합니다");
        }
        if (silverThreshold > goldThreshold) {
            throw new IllegalArgumentException("실버 기준은 골드 기준보다 클 수 없습니다");
        }
        this.pointsRate = pointsRate;
        this.silverThreshold = silverThreshold;
        this.goldThreshold = goldThreshold;
    }

    public long pointsFor(long totalAmount) {
        if (totalAmount <= 0) {
            return 0L;
        }
        return BigDecimal.valueOf(totalAmount)
                .multiply(pointsRate)
                .setScale(0, RoundingMode.FLOOR)
                .longValue();
    }

    public LoyaltyTier tierFor(long balance) {
        if (balance >= goldThreshold) {
            return LoyaltyTier.GOLD;
        }
        if (balance >= silverThreshold) {
            return LoyaltyTier.SILVER;
        }
        return LoyaltyTier.BRONZE;
    }
}
