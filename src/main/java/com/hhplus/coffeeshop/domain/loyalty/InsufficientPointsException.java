package com.hhplus.coffeeshop.domain.loyalty;

import com.hhplus.coffeeshop.common.exception.DomainException;
import com.hhplus.coffeeshop.common.exception.ErrorCode;

/**
 * InsufficientPointsException - 포인트 부족 예외
 *
 * 사용하려는 포인트가 현재 잔액보다 클 때 발생합니다.
 */
public class InsufficientPointsException extends DomainException {
    private final Long userId;
    private final long currentBalance;
    private final long requiredPoints;

    public InsufficientPointsException(Long userId, long currentBalance, long requiredPoints) {
        super(ErrorCode.INSUFFICIENT_POINTS, String.format(
                "사용자=%d, 보유포인트=%d, 필요포인트=%d", userId, currentBalance, requiredPoints));
        this.userId = userId;
        this.currentBalance = currentBalance;
        this.requiredPoints = requiredPoints;
    }

    public Long getUserId() {
        return userId;
    }

    public long getCurrentBalance() {
        return currentBalance;
    }

    public long getRequiredPoints() {
        return requiredPoints;
    }
}
