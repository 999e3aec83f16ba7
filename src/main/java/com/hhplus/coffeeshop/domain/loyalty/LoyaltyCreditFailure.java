package com.hhplus.coffeeshop.domain.loyalty;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 주문 커밋 이후 포인트 적립에 실패한 건 (재처리 대상)
 */
@Entity
@Table(name = "loyalty_credit_failures",
        indexes = @Index(name = "idx_loyalty_failure_resolved", columnList = "resolved"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoyaltyCreditFailure {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "loyalty_credit_failure_id")
    private Long loyaltyCreditFailureId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "order_number", nullable = false, length = 30)
    private String orderNumber;

    @Column(name = "total_amount", nullable = false)
    private Long totalAmount;

    @Column(name = "reason", length = 500)
    private String reason;

    @Column(name = "resolved", nullable = false)
    @Builder.Default
    private Boolean resolved = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    public static LoyaltyCreditFailure of(Long userId, Long orderId, String orderNumber, Long totalAmount, String reason) {
        String trimmed = reason != null && reason.length() > 500 ? reason.substring(0, 500) : reason;
        return LoyaltyCreditFailure.builder()
                .userId(userId)
                .orderId(orderId)
                .orderNumber(orderNumber)
                .totalAmount(totalAmount)
                .reason(trimmed)
                .resolved(false)
                .createdAt(LocalDateTime.now())
                .build();
    }

    public void markResolved() {
        this.resolved = true;
        this.resolvedAt = LocalDateTime.now();
    }
}
