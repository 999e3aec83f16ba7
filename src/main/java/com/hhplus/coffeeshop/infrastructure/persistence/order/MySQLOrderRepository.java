package com.hhplus.coffeeshop.infrastructure.persistence.order;

import com.hhplus.coffeeshop.domain.order.Order;
import com.hhplus.coffeeshop.domain.order.OrderRepository;
import com.hhplus.coffeeshop.domain.order.OrderStatus;
import com.hhplus.coffeeshop.domain.order.OrderStatusHistory;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Order Repository 구현
 *
 * 주문 항목은 Order 저장 시 cascade로 함께 저장됩니다.
 * 상태 변경 이력(order_status_history)도 이 Repository에서 다룹니다.
 */
@Repository
@Primary
@Transactional
public class MySQLOrderRepository implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;
    private final OrderStatusHistoryJpaRepository historyJpaRepository;

    public MySQLOrderRepository(OrderJpaRepository orderJpaRepository,
                                OrderStatusHistoryJpaRepository historyJpaRepository) {
        this.orderJpaRepository = orderJpaRepository;
        this.historyJpaRepository = historyJpaRepository;
    }

    @Override
    public Order save(Order order) {
        return orderJpaRepository.save(order);
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return orderJpaRepository.findByIdWithLines(orderId);
    }

    @Override
    public Optional<Order> findByIdForUpdate(Long orderId) {
        return orderJpaRepository.findByIdWithLock(orderId);
    }

    @Override
    public Optional<Order> findByOrderNumber(String orderNumber) {
        return orderJpaRepository.findByOrderNumberWithLines(orderNumber);
    }

    @Override
    public boolean existsByOrderNumber(String orderNumber) {
        return orderJpaRepository.existsByOrderNumber(orderNumber);
    }

    @Override
    public List<Order> findByUserId(Long userId) {
        return orderJpaRepository.findByUserIdWithLines(userId);
    }

    @Override
    public List<Order> findByStatus(OrderStatus status) {
        return orderJpaRepository.findByStatus(status);
    }

    @Override
    public OrderStatusHistory saveHistory(OrderStatusHistory history) {
        return historyJpaRepository.save(history);
    }

    @Override
    public List<OrderStatusHistory> findHistoryByOrderId(Long orderId) {
        return historyJpaRepository.findByOrderIdOrderByChangedAtAscHistoryIdAsc(orderId);
    }
}
