package com.hhplus.coffeeshop.application.order;

import com.hhplus.coffeeshop.application.order.dto.OrderStatusHistoryView;
import com.hhplus.coffeeshop.application.order.dto.OrderView;
import com.hhplus.coffeeshop.domain.order.InvalidOrderTransitionException;
import com.hhplus.coffeeshop.domain.order.Order;
import com.hhplus.coffeeshop.domain.order.OrderNotFoundException;
import com.hhplus.coffeeshop.domain.order.OrderRepository;
import com.hhplus.coffeeshop.domain.order.OrderStatus;
import com.hhplus.coffeeshop.domain.order.PaymentStatus;
import com.hhplus.coffeeshop.domain.order.event.OrderStatusChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderLifecycleService - 주문 상태 전환 (Application 계층)
 *
 * 상태 전환은 주문 행 비관적 락 안에서 수행되며, 커밋 이후
 * OrderStatusChangedEvent 리스너가 사용자 알림과 관리자 변경 이력을 기록합니다.
 * 알림/이력 기록 실패는 상태 전환 결과에 영향을 주지 않습니다.
 */
@Service
public class OrderLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleService.class);

    private final OrderRepository orderRepository;
    private final OrderValidator orderValidator;
    private final ApplicationEventPublisher eventPublisher;

    public OrderLifecycleService(OrderRepository orderRepository,
                                 OrderValidator orderValidator,
                                 ApplicationEventPublisher eventPublisher) {
        this.orderRepository = orderRepository;
        this.orderValidator = orderValidator;
        this.eventPublisher = eventPublisher;
    }

    /**
     * 관리자 상태 변경
     *
     * @param status 요청 상태 문자열 (대소문자 무관)
     * @throws InvalidOrderTransitionException 알 수 없는 상태 또는 허용되지 않은 전환
     */
    @Transactional
    public OrderView transitionStatus(Long orderId, String status, Long adminId, String notes) {
        OrderStatus next = OrderStatus.parse(status)
                .orElseThrow(() -> new InvalidOrderTransitionException(orderId, status));
        Order order = lockOrder(orderId);
        LocalDateTime now = LocalDateTime.now();

        OrderStatus previous = order.transitionTo(next, now);
        Order saved = orderRepository.save(order);
        publishChanged(saved, previous, adminId, notes, now);

        log.info("[OrderLifecycleService] 주문 상태 변경 - orderId={}, {} → {}, adminId={}",
                orderId, previous, next, adminId);
        return OrderView.from(saved);
    }

    /**
     * 사용자 주문 취소 (PENDING, CONFIRMED 상태만 가능)
     *
     * 포인트와 바우처 사용 내역은 되돌리지 않습니다.
     */
    @Transactional
    public OrderView cancel(Long orderId, Long userId, String reason) {
        Order order = lockOrder(orderId);
        orderValidator.validateOwner(order, userId);
        LocalDateTime now = LocalDateTime.now();

        OrderStatus previous = order.cancel(reason, now);
        Order saved = orderRepository.save(order);
        publishChanged(saved, previous, null, reason, now);

        log.info("[OrderLifecycleService] 주문 취소 - orderId={}, userId={}, previous={}", orderId, userId, previous);
        return OrderView.from(saved);
    }

    /**
     * 결제 상태 변경
     *
     * @throws IllegalArgumentException 알 수 없는 결제 상태
     */
    @Transactional
    public OrderView updatePaymentStatus(Long orderId, String paymentStatus) {
        PaymentStatus next = PaymentStatus.fromString(paymentStatus);
        Order order = lockOrder(orderId);
        order.changePaymentStatus(next, LocalDateTime.now());
        Order saved = orderRepository.save(order);
        log.info("[OrderLifecycleService] 결제 상태 변경 - orderId={}, paymentStatus={}", orderId, next);
        return OrderView.from(saved);
    }

    @Transactional(readOnly = true)
    public List<OrderStatusHistoryView> history(Long orderId) {
        if (orderRepository.findById(orderId).isEmpty()) {
            throw new OrderNotFoundException(orderId);
        }
        return orderRepository.findHistoryByOrderId(orderId).stream()
                .map(OrderStatusHistoryView::from)
                .collect(Collectors.toList());
    }

    private Order lockOrder(Long orderId) {
        return orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    private void publishChanged(Order order, OrderStatus previous, Long adminId, String notes, LocalDateTime now) {
        eventPublisher.publishEvent(new OrderStatusChangedEvent(
                this, order.getOrderId(), order.getOrderNumber(), order.getUserId(),
                previous, order.getStatus(), adminId, notes, now));
    }
}
