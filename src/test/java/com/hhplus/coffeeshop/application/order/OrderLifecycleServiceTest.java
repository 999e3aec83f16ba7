package com.hhplus.coffeeshop.application.order;

import com.hhplus.coffeeshop.application.order.dto.OrderView;
import com.hhplus.coffeeshop.domain.order.InvalidOrderTransitionException;
import com.hhplus.coffeeshop.domain.order.Order;
import com.hhplus.coffeeshop.domain.order.OrderNotFoundException;
import com.hhplus.coffeeshop.domain.order.OrderRepository;
import com.hhplus.coffeeshop.domain.order.OrderStatus;
import com.hhplus.coffeeshop.domain.order.PaymentStatus;
import com.hhplus.coffeeshop.domain.order.UserMismatchException;
import com.hhplus.coffeeshop.domain.order.event.OrderStatusChangedEvent;
import com.hhplus.coffeeshop.domain.user.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.LocalDateTime;
import java.util.Optional;

import static com.hhplus.coffeeshop.application.order.OrderFixtures.PRODUCT_ID;
import static com.hhplus.coffeeshop.application.order.OrderFixtures.USER_ID;
import static com.hhplus.coffeeshop.application.order.OrderFixtures.orderLine;
import static com.hhplus.coffeeshop.application.order.OrderFixtures.pickupOrder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderLifecycleService 단위 테스트")
class OrderLifecycleServiceTest {

    private static final Long ORDER_ID = 5L;
    private static final Long ADMIN_ID = 900L;

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private OrderLifecycleService orderLifecycleService;

    @BeforeEach
    void setUp() {
        orderLifecycleService = new OrderLifecycleService(orderRepository, new OrderValidator(userRepository), eventPublisher);
    }

    @Test
    @DisplayName("관리자 상태 변경은 대소문자를 구분하지 않고 변경 이벤트에 관리자 ID를 담는다")
    void transitionPublishesEvent() {
        Order order = pickupOrder(orderLine(PRODUCT_ID));
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order));
        when(orderRepository.save(order)).thenReturn(order);

        OrderView view = orderLifecycleService.transitionStatus(ORDER_ID, "confirmed", ADMIN_ID, "확인 완료");

        assertThat(view.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        ArgumentCaptor<OrderStatusChangedEvent> event = ArgumentCaptor.forClass(OrderStatusChangedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().getPreviousStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(event.getValue().getNewStatus()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(event.getValue().isAdminAction()).isTrue();
        assertThat(event.getValue().getNotes()).isEqualTo("확인 완료");
    }

    @Test
    @DisplayName("알 수 없는 상태 값은 주문을 조회하기 전에 거부한다")
    void unknownStatus() {
        assertThatThrownBy(() -> orderLifecycleService.transitionStatus(ORDER_ID, "SHIPPED", ADMIN_ID, null))
                .isInstanceOf(InvalidOrderTransitionException.class);
        verify(orderRepository, never()).findByIdForUpdate(any());
    }

    @Test
    @DisplayName("허용되지 않은 전환은 저장도 이벤트 발행도 하지 않는다")
    void invalidTransition() {
        Order order = pickupOrder(orderLine(PRODUCT_ID));
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order));

        assertThatThrownBy(() -> orderLifecycleService.transitionStatus(ORDER_ID, "COMPLETED", ADMIN_ID, null))
                .isInstanceOf(InvalidOrderTransitionException.class);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        verify(orderRepository, never()).save(any());
        verify(eventPublisher, never()).publishEvent(any());
    }

    @Test
    @DisplayName("사용자 취소는 소유자만 가능하고 관리자 ID 없이 이벤트를 발행한다")
    void cancelByOwner() {
        Order order = pickupOrder(orderLine(PRODUCT_ID));
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order));
        when(orderRepository.save(order)).thenReturn(order);

        OrderView view = orderLifecycleService.cancel(ORDER_ID, USER_ID, "변심");

        assertThat(view.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(view.getCancellationReason()).isEqualTo("변심");
        ArgumentCaptor<OrderStatusChangedEvent> event = ArgumentCaptor.forClass(OrderStatusChangedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().isAdminAction()).isFalse();
    }

    @Test
    @DisplayName("다른 사용자의 주문은 취소할 수 없다")
    void cancelByOtherUser() {
        Order order = pickupOrder(orderLine(PRODUCT_ID));
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order));

        assertThatThrownBy(() -> orderLifecycleService.cancel(ORDER_ID, 2L, null))
                .isInstanceOf(UserMismatchException.class);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
    }

    @Test
    @DisplayName("준비 중인 주문은 취소할 수 없다")
    void cancelAfterPreparing() {
        Order order = pickupOrder(orderLine(PRODUCT_ID));
        order.transitionTo(OrderStatus.CONFIRMED, LocalDateTime.now());
        order.transitionTo(OrderStatus.PREPARING, LocalDateTime.now());
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order));

        assertThatThrownBy(() -> orderLifecycleService.cancel(ORDER_ID, USER_ID, null))
                .isInstanceOf(InvalidOrderTransitionException.class);
    }

    @Test
    @DisplayName("결제 상태 변경")
    void updatePaymentStatus() {
        Order order = pickupOrder(orderLine(PRODUCT_ID));
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order));
        when(orderRepository.save(order)).thenReturn(order);

        OrderView view = orderLifecycleService.updatePaymentStatus(ORDER_ID, "paid");

        assertThat(view.getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
    }

    @Test
    @DisplayName("존재하지 않는 주문의 이력은 조회할 수 없다")
    void historyOfUnknownOrder() {
        when(orderRepository.findById(ORDER_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> orderLifecycleService.history(ORDER_ID))
                .isInstanceOf(OrderNotFoundException.class);
    }
}
