package com.hhplus.coffeeshop.infrastructure.persistence.order;

import com.hhplus.coffeeshop.domain.order.OrderStatusHistory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface OrderStatusHistoryJpaRepository extends JpaRepository<OrderStatusHistory, Long> {

    List<OrderStatusHistory> findByOrderIdOrderByChangedAtAscHistoryIdAsc(Long orderId);
}
