package com.hhplus.coffeeshop.domain.order;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * OrderStatus - 주문 상태 머신
 *
 * 상태 전환 규칙:
 * PENDING → CONFIRMED → PREPARING → READY → COMPLETED
 * READY → DELIVERING → COMPLETED (배달 주문만)
 * PENDING, CONFIRMED → CANCELLED
 *
 * COMPLETED, CANCELLED는 종료 상태이며 이외의 전환은 모두 허용되지 않습니다.
 */
@Getter
public enum OrderStatus {
    PENDING("주문 접수"),
    CONFIRMED("주문 확인"),
    PREPARING("준비 중"),
    READY("준비 완료"),
    DELIVERING("배달 중"),
    COMPLETED("완료"),
    CANCELLED("취소");

    private final String displayName;

    OrderStatus(String displayName) {
        this.displayName = displayName;
    }

    /**
     * 다음 상태로 전환 가능한지 확인
     */
    public boolean canTransitionTo(OrderStatus next, OrderType orderType) {
        if (next == null) {
            return false;
        }
        return nextStatuses(orderType).contains(next);
    }

    public Set<OrderStatus> nextStatuses(OrderType orderType) {
        boolean delivery = orderType == OrderType.DELIVERY;
        switch (this) {
            case PENDING:
                return EnumSet.of(CONFIRMED, CANCELLED);
            case CONFIRMED:
                return EnumSet.of(PREPARING, CANCELLED);
            case PREPARING:
                return EnumSet.of(READY);
            case READY:
                return delivery ? EnumSet.of(DELIVERING) : EnumSet.of(COMPLETED);
            case DELIVERING:
                return delivery ? EnumSet.of(COMPLETED) : EnumSet.noneOf(OrderStatus.class);
            default:
                return EnumSet.noneOf(OrderStatus.class);
        }
    }

    /**
     * 주문 유형별 정상 진행 경로 (추적 화면용)
     */
    public static List<OrderStatus> progressionFor(OrderType orderType) {
        List<OrderStatus> steps = new ArrayList<>(List.of(PENDING, CONFIRMED, PREPARING, READY));
        if (orderType == OrderType.DELIVERY) {
            steps.add(DELIVERING);
        }
        steps.add(COMPLETED);
        return Collections.unmodifiableList(steps);
    }

    /**
     * 문자열에서 OrderStatus로 변환 (알 수 없는 값은 empty)
     */
    public static Optional<OrderStatus> parse(String status) {
        if (status == null || status.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OrderStatus.valueOf(status.trim().toUpperCase()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
