package com.hhplus.coffeeshop.domain.loyalty;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * LoyaltyAccount - 사용자 레코드에 포함되는 포인트 계정 (Embeddable)
 *
 * 핵심 비즈니스 규칙:
 * - 잔액은 0 미만이 될 수 없음
 * - tier는 잔액 변경과 함께 갱신되는 캐시 컬럼이며 원천은 잔액
 * - 잔액 = 해당 사용자 LoyaltyTransaction delta의 합 (변경은 항상 거래 기록과 함께)
 */
@Embeddable
@Getter
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoyaltyAccount {

    @Column(name = "loyalty_points", nullable = false)
    private Long pointsBalance;

    @Column(name = "loyalty_tier", nullable = false, length = 10)
    @Enumerated(EnumType.STRING)
    private LoyaltyTier tier;

    public static LoyaltyAccount empty() {
        return new LoyaltyAccount(0L, LoyaltyTier.BRONZE);
    }

    public long balance() {
        return pointsBalance == null ? 0L : pointsBalance;
    }

    /**
     * 포인트 적립
     *
     * @return 등급이 변경되었으면 true
     */
    public boolean credit(long points, LoyaltyPolicy policy) {
        if (points <= 0) {
            throw new IllegalArgumentException("적립 포인트는 0보다 커야 합니다");
        }
        return apply(balance() + points, policy);
    }

    /**
     * 포인트 사용
     *
     * @throws InsufficientPointsException 사용 포인트가 잔액보다 큰 경우
     */
    public boolean debit(Long userId, long points, LoyaltyPolicy policy) {
        if (points <= 0) {
            throw new IllegalArgumentException("사용 포인트는 0보다 커야 합니다");
        }
        if (points > balance()) {
            throw new InsufficientPointsException(userId, balance(), points);
        }
        return apply(balance() - points, policy);
    }

    /**
     * 관리자 조정 (부호 있는 delta)
     *
     * @throws InsufficientPointsException 조정 결과가 음수가 되는 경우
     */
    public boolean adjust(Long userId, long delta, LoyaltyPolicy policy) {
        if (delta == 0) {
            throw new IllegalArgumentException("조정 포인트는 0이 될 수 없습니다");
        }
        long next = balance() + delta;
        if (next < 0) {
            throw new InsufficientPointsException(userId, balance(), -delta);
        }
        return apply(next, policy);
    }

    private boolean apply(long newBalance, LoyaltyPolicy policy) {
        LoyaltyTier previous = this.tier;
        this.pointsBalance = newBalance;
        this.tier = policy.tierFor(newBalance);
        return previous != this.tier;
    }
}
