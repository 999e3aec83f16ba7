package com.hhplus.coffeeshop.domain.order;

import java.util.List;
import java.util.Optional;

/**
 * 주문 저장소 포트
 */
public interface OrderRepository {

    Order save(Order order);

    Optional<Order> findById(Long orderId);

    /**
     * 비관적 락으로 조회 (상태 전환용)
     */
    Optional<Order> findByIdForUpdate(Long orderId);

    Optional<Order> findByOrderNumber(String orderNumber);

    boolean existsByOrderNumber(String orderNumber);

    /**
     * 사용자 주문 목록 (최신순)
     */
    List<Order> findByUserId(Long userId);

    List<Order> findByStatus(OrderStatus status);

    OrderStatusHistory saveHistory(OrderStatusHistory history);

    List<OrderStatusHistory> findHistoryByOrderId(Long orderId);
}
