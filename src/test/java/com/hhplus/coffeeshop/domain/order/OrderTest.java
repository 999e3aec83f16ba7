package com.hhplus.coffeeshop.domain.order;

import com.hhplus.coffeeshop.domain.cart.Temperature;
import com.hhplus.coffeeshop.domain.product.CupSize;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Order 도메인 테스트")
class OrderTest {

    private final LocalDateTime now = LocalDateTime.of(2025, 6, 1, 9, 0);

    private OrderLine line(int quantity, long unitPrice) {
        return OrderLine.of(1L, "밀크티", CupSize.M, quantity, unitPrice, 50, 50, Temperature.COLD, Set.of(10L), 5_000L);
    }

    private Order pickupOrder(OrderType type) {
        return Order.create("ORD-20250601-ABC123", 7L, type,
                OrderDestination.of(1L, "서울시 강남구", "A1"), PaymentMethod.CASH, null,
                OrderAmounts.of(55_000L, 5_500L, 0L), 3L, "SAVE10",
                List.of(line(1, 55_000L)), now.plusMinutes(23), now);
    }

    @Nested
    @DisplayName("주문 생성")
    class Create {

        @Test
        @DisplayName("생성 직후 PENDING / 결제 대기 상태이며 금액이 고정된다")
        void createsPendingOrder() {
            Order order = pickupOrder(OrderType.PICKUP);

            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
            assertThat(order.getTotalAmount()).isEqualTo(49_500L);
            assertThat(order.getOrderLines()).hasSize(1);
            assertThat(order.itemCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("주문 항목 합계와 주문 금액이 다르면 생성할 수 없다")
        void rejectsMismatchedSubtotal() {
            assertThatThrownBy(() -> Order.create("ORD-1", 7L, OrderType.PICKUP, OrderDestination.of(1L, null, null),
                    PaymentMethod.CARD, null, OrderAmounts.of(60_000L, 0L, 0L), null, null,
                    List.of(line(1, 55_000L)), now, now))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("주문 항목이 없으면 생성할 수 없다")
        void rejectsEmptyLines() {
            assertThatThrownBy(() -> Order.create("ORD-1", 7L, OrderType.PICKUP, OrderDestination.of(1L, null, null),
                    PaymentMethod.CARD, null, OrderAmounts.of(0L, 0L, 0L), null, null, List.of(), now, now))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("할인액은 주문 금액을 넘을 수 없다")
        void rejectsDiscountOverSubtotal() {
            assertThatThrownBy(() -> OrderAmounts.of(10_000L, 10_001L, 0L))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("상태 전환")
    class Transition {

        @Test
        @DisplayName("COMPLETED로 전환하면 완료 시각이 기록된다")
        void recordsCompletedAt() {
            Order order = pickupOrder(OrderType.PICKUP);
            order.transitionTo(OrderStatus.CONFIRMED, now);
            order.transitionTo(OrderStatus.PREPARING, now);
            order.transitionTo(OrderStatus.READY, now);

            OrderStatus previous = order.transitionTo(OrderStatus.COMPLETED, now.plusMinutes(30));

            assertThat(previous).isEqualTo(OrderStatus.READY);
            assertThat(order.getCompletedAt()).isEqualTo(now.plusMinutes(30));
        }

        @Test
        @DisplayName("허용되지 않은 전환은 예외이며 상태가 바뀌지 않는다")
        void rejectsInvalidTransition() {
            Order order = pickupOrder(OrderType.PICKUP);

            assertThatThrownBy(() -> order.transitionTo(OrderStatus.READY, now))
                    .isInstanceOf(InvalidOrderTransitionException.class);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        }

        @Test
        @DisplayName("준비가 시작된 주문은 취소할 수 없다")
        void cannotCancelAfterPreparing() {
            Order order = pickupOrder(OrderType.DINE_IN);
            order.transitionTo(OrderStatus.CONFIRMED, now);
            order.transitionTo(OrderStatus.PREPARING, now);

            assertThatThrownBy(() -> order.cancel("변심", now))
                    .isInstanceOf(InvalidOrderTransitionException.class);
        }

        @Test
        @DisplayName("취소하면 사유와 취소 시각이 기록된다")
        void cancelRecordsReason() {
            Order order = pickupOrder(OrderType.PICKUP);

            order.cancel("변심", now);

            assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(order.getCancellationReason()).isEqualTo("변심");
            assertThat(order.getCancelledAt()).isEqualTo(now);
        }
    }

    @Test
    @DisplayName("주문 유형별 필수 수령 정보를 검증한다")
    void destinationValidation() {
        OrderDestination pickupOnly = OrderDestination.of(1L, "  ", null);

        pickupOnly.validateFor(OrderType.PICKUP);
        assertThatThrownBy(() -> pickupOnly.validateFor(OrderType.DELIVERY))
                .isInstanceOf(MissingRequiredFieldException.class)
                .hasMessageContaining("delivery_address");
        assertThatThrownBy(() -> pickupOnly.validateFor(OrderType.DINE_IN))
                .isInstanceOf(MissingRequiredFieldException.class)
                .hasMessageContaining("table_number");
    }
}
