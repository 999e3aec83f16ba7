package com.hhplus.coffeeshop.domain.order;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OrderStatus 상태 머신 테스트")
class OrderStatusTest {

    @ParameterizedTest(name = "[{0}] {1} → {2} = {3}")
    @CsvSource({
            "PICKUP, PENDING, CONFIRMED, true",
            "PICKUP, PENDING, CANCELLED, true",
            "PICKUP, CONFIRMED, PREPARING, true",
            "PICKUP, CONFIRMED, CANCELLED, true",
            "PICKUP, PREPARING, READY, true",
            "PICKUP, PREPARING, CANCELLED, false",
            "PICKUP, READY, COMPLETED, true",
            "PICKUP, READY, DELIVERING, false",
            "DELIVERY, READY, DELIVERING, true",
            "DELIVERY, READY, COMPLETED, false",
            "DELIVERY, DELIVERING, COMPLETED, true",
            "DINE_IN, PENDING, READY, false",
            "DINE_IN, COMPLETED, PENDING, false",
            "DINE_IN, CANCELLED, CONFIRMED, false"
    })
    @DisplayName("주문 유형별 허용 전환")
    void transitions(OrderType type, OrderStatus from, OrderStatus to, boolean allowed) {
        assertThat(from.canTransitionTo(to, type)).isEqualTo(allowed);
    }

    @Test
    @DisplayName("배달 주문만 DELIVERING 단계를 가진다")
    void progression() {
        assertThat(OrderStatus.progressionFor(OrderType.DELIVERY))
                .containsExactly(OrderStatus.PENDING, OrderStatus.CONFIRMED, OrderStatus.PREPARING,
                        OrderStatus.READY, OrderStatus.DELIVERING, OrderStatus.COMPLETED);
        assertThat(OrderStatus.progressionFor(OrderType.PICKUP)).doesNotContain(OrderStatus.DELIVERING);
    }

    @Test
    @DisplayName("상태 문자열은 대소문자를 구분하지 않고 알 수 없는 값은 empty")
    void parse() {
        assertThat(OrderStatus.parse(" preparing ")).contains(OrderStatus.PREPARING);
        assertThat(OrderStatus.parse("SHIPPED")).isEmpty();
        assertThat(OrderStatus.parse(null)).isEmpty();
    }
}
