package com.hhplus.coffeeshop.domain.order;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 관리자 주문 상태 변경 이력
 */
@Entity
@Table(name = "order_status_history",
        indexes = @Index(name = "idx_order_status_history_order", columnList = "order_id"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusHistory {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "history_id")
    private Long historyId;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "old_status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private OrderStatus oldStatus;

    @Column(name = "new_status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private OrderStatus newStatus;

    @Column(name = "changed_by_admin_id")
    private Long changedByAdminId;

    @Column(name = "notes", length = 500)
    private String notes;

    @Column(name = "changed_at", nullable = false)
    private LocalDateTime changedAt;

    public static OrderStatusHistory of(Long orderId, OrderStatus oldStatus, OrderStatus newStatus,
                                        Long adminId, String notes, LocalDateTime changedAt) {
        return OrderStatusHistory.builder()
                .orderId(orderId)
                .oldStatus(oldStatus)
                .newStatus(newStatus)
                .changedByAdminId(adminId)
                .notes(notes)
                .changedAt(changedAt)
                .build();
    }
}
