package com.hhplus.coffeeshop.domain.loyalty;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * LoyaltyTransaction - 포인트 원장 항목 (append-only)
 *
 * delta는 부호 있는 값입니다 (적립 +, 사용 -, 관리자 조정 ±).
 */
@Entity
@Table(name = "loyalty_transactions",
        uniqueConstraints = @UniqueConstraint(name = "uk_loyalty_tx_order_type", columnNames = {"order_id", "transaction_type"}),
        indexes = {
                @Index(name = "idx_loyalty_tx_user", columnList = "user_id, created_at")
        })
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoyaltyTransaction {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "loyalty_transaction_id")
    private Long loyaltyTransactionId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "delta", nullable = false)
    private Long delta;

    @Column(name = "transaction_type", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private LoyaltyTransactionType type;

    @Column(name = "description")
    private String description;

    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "admin_id")
    private Long adminId;

    @Column(name = "balance_after", nullable = false)
    private Long balanceAfter;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static LoyaltyTransaction earn(Long userId, long points, String description, Long orderId, long balanceAfter) {
        return LoyaltyTransaction.builder()
                .userId(userId)
                .delta(points)
                .type(LoyaltyTransactionType.EARN)
                .description(description)
                .orderId(orderId)
                .balanceAfter(balanceAfter)
                .createdAt(LocalDateTime.now())
                .build();
    }

    public static LoyaltyTransaction redeem(Long userId, long points, String description, long balanceAfter) {
        return LoyaltyTransaction.builder()
                .userId(userId)
                .delta(-points)
                .type(LoyaltyTransactionType.REDEEM)
                .description(description)
                .balanceAfter(balanceAfter)
                .createdAt(LocalDateTime.now())
                .build();
    }

    public static LoyaltyTransaction adjustment(Long userId, long delta, String description, Long adminId, long balanceAfter) {
        return LoyaltyTransaction.builder()
                .userId(userId)
                .delta(delta)
                .type(LoyaltyTransactionType.ADMIN_ADJUSTMENT)
                .description(description)
                .adminId(adminId)
                .balanceAfter(balanceAfter)
                .createdAt(LocalDateTime.now())
                .build();
    }
}
