package com.hhplus.coffeeshop.infrastructure.persistence.order;

import com.hhplus.coffeeshop.domain.order.Order;
import com.hhplus.coffeeshop.domain.order.OrderStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Order JPA Repository
 */
public interface OrderJpaRepository extends JpaRepository<Order, Long> {

    /**
     * 주문 조회 + 주문 항목 Fetch Join (N+1 방지)
     */
    @Query("SELECT DISTINCT o FROM Order o LEFT JOIN FETCH o.orderLines WHERE o.orderId = :orderId")
    Optional<Order> findByIdWithLines(@Param("orderId") Long orderId);

    /**
     * 주문 조회 (비관적 락 - 상태 전이 직렬화)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT o FROM Order o WHERE o.orderId = :orderId")
    Optional<Order> findByIdWithLock(@Param("orderId") Long orderId);

    @Query("SELECT DISTINCT o FROM Order o LEFT JOIN FETCH o.orderLines WHERE o.orderNumber = :orderNumber")
    Optional<Order> findByOrderNumberWithLines(@Param("orderNumber") String orderNumber);

    boolean existsByOrderNumber(String orderNumber);

    @Query("SELECT DISTINCT o FROM Order o LEFT JOIN FETCH o.orderLines " +
            "WHERE o.userId = :userId ORDER BY o.createdAt DESC, o.orderId DESC")
    List<Order> findByUserIdWithLines(@Param("userId") Long userId);

    @Query("SELECT o FROM Order o WHERE o.status = :status ORDER BY o.createdAt ASC, o.orderId ASC")
    List<Order> findByStatus(@Param("status") OrderStatus status);
}
