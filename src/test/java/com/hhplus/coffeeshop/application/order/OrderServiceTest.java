package com.hhplus.coffeeshop.application.order;

import com.hhplus.coffeeshop.application.cart.CartService;
import com.hhplus.coffeeshop.application.cart.dto.AddCartItemCommand;
import com.hhplus.coffeeshop.application.order.dto.CreateOrderCommand;
import com.hhplus.coffeeshop.application.order.dto.OrderTrackingView;
import com.hhplus.coffeeshop.application.order.dto.ReorderResult;
import com.hhplus.coffeeshop.domain.order.MissingRequiredFieldException;
import com.hhplus.coffeeshop.domain.order.Order;
import com.hhplus.coffeeshop.domain.order.OrderRepository;
import com.hhplus.coffeeshop.domain.order.OrderStatus;
import com.hhplus.coffeeshop.domain.order.OrderType;
import com.hhplus.coffeeshop.domain.order.PaymentMethod;
import com.hhplus.coffeeshop.domain.order.UserMismatchException;
import com.hhplus.coffeeshop.domain.product.ProductNotFoundException;
import com.hhplus.coffeeshop.domain.user.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Optional;

import static com.hhplus.coffeeshop.application.order.OrderFixtures.PRODUCT_ID;
import static com.hhplus.coffeeshop.application.order.OrderFixtures.USER_ID;
import static com.hhplus.coffeeshop.application.order.OrderFixtures.orderLine;
import static com.hhplus.coffeeshop.application.order.OrderFixtures.pickupOrder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderService 단위 테스트")
class OrderServiceTest {

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private OrderTransactionService orderTransactionService;

    @Mock
    private CartService cartService;

    private OrderService orderService;

    @BeforeEach
    void setUp() {
        orderService = new OrderService(orderRepository, new OrderValidator(userRepository),
                orderTransactionService, cartService);
    }

    @Test
    @DisplayName("배달 주소 없는 배달 주문은 트랜잭션 시작 전에 거부된다")
    void deliveryWithoutAddress() {
        when(userRepository.existsById(USER_ID)).thenReturn(true);
        CreateOrderCommand command = CreateOrderCommand.builder()
                .orderType(OrderType.DELIVERY)
                .paymentMethod(PaymentMethod.CASH)
                .build();

        assertThatThrownBy(() -> orderService.createFromCart(USER_ID, command))
                .isInstanceOf(MissingRequiredFieldException.class);
        verify(orderTransactionService, never()).materialize(any(), any());
    }

    @Test
    @DisplayName("다른 사용자의 주문은 조회할 수 없다")
    void getOwnedMismatch() {
        when(orderRepository.findById(5L)).thenReturn(Optional.of(pickupOrder(orderLine(PRODUCT_ID))));

        assertThatThrownBy(() -> orderService.getOwned(5L, 2L))
                .isInstanceOf(UserMismatchException.class);
    }

    @Test
    @DisplayName("알 수 없는 상태로 목록을 조회하면 IllegalArgumentException")
    void listByUnknownStatus() {
        assertThatThrownBy(() -> orderService.listByStatus("SHIPPED"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("주문 추적")
    class Track {

        @Test
        @DisplayName("현재 단계까지 done, 현재 단계만 current로 표시한다")
        void marksProgress() {
            Order order = pickupOrder(orderLine(PRODUCT_ID));
            LocalDateTime now = LocalDateTime.now();
            order.transitionTo(OrderStatus.CONFIRMED, now);
            order.transitionTo(OrderStatus.PREPARING, now);
            when(orderRepository.findById(5L)).thenReturn(Optional.of(order));

            OrderTrackingView view = orderService.track(5L, USER_ID);

            assertThat(view.getSteps()).hasSize(5);
            assertThat(view.getSteps()).extracting(OrderTrackingView.Step::isDone)
                    .containsExactly(true, true, true, false, false);
            assertThat(view.getSteps()).extracting(OrderTrackingView.Step::isCurrent)
                    .containsExactly(false, false, true, false, false);
        }

        @Test
        @DisplayName("취소된 주문은 빈 타임라인을 반환한다")
        void cancelledOrder() {
            Order order = pickupOrder(orderLine(PRODUCT_ID));
            order.cancel("변심", LocalDateTime.now());
            when(orderRepository.findById(5L)).thenReturn(Optional.of(order));

            OrderTrackingView view = orderService.track(5L, USER_ID);

            assertThat(view.getStatus()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(view.getSteps()).isEmpty();
        }
    }

    @Test
    @DisplayName("재주문 시 판매 중지된 상품은 건너뛰고 나머지는 장바구니에 담는다")
    void reorderSkipsDiscontinued() {
        when(orderRepository.findById(5L)).thenReturn(Optional.of(pickupOrder(orderLine(PRODUCT_ID), orderLine(200L))));
        when(cartService.addItem(eq(USER_ID), any(AddCartItemCommand.class))).thenAnswer(invocation -> {
            AddCartItemCommand command = invocation.getArgument(1);
            if (command.getProductId().equals(200L)) {
                throw new ProductNotFoundException(200L);
            }
            return null;
        });

        ReorderResult result = orderService.reorder(5L, USER_ID);

        assertThat(result.getAddedLines()).isEqualTo(1);
        assertThat(result.getSkippedLines()).isEqualTo(1);
    }
}
