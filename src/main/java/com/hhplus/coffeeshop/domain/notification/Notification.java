package com.hhplus.coffeeshop.domain.notification;

import com.hhplus.coffeeshop.domain.order.OrderStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 사용자 알림 엔티티
 */
@Entity
@Table(name = "notifications",
        indexes = @Index(name = "idx_notifications_user", columnList = "user_id, is_read"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "notification_id")
    private Long notificationId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "notification_type", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private NotificationType type;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "message", nullable = false, length = 500)
    private String message;

    @Column(name = "is_read", nullable = false)
    @Builder.Default
    private Boolean isRead = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 주문 상태 변경 알림 생성
     * 제목: "주문 업데이트 #{orderNumber}", 메시지: 새 상태별 안내 문구
     */
    public static Notification orderUpdate(Long userId, Long orderId, String orderNumber, OrderStatus newStatus) {
        return Notification.builder()
                .userId(userId)
                .orderId(orderId)
                .type(NotificationType.ORDER_UPDATE)
                .title("주문 업데이트 #" + orderNumber)
                .message(OrderStatusMessages.messageFor(newStatus))
                .isRead(false)
                .createdAt(LocalDateTime.now())
                .build();
    }

    public boolean isOwnedBy(Long userId) {
        return Objects.equals(this.userId, userId);
    }

    public void markRead() {
        this.isRead = true;
    }
}
