package com.hhplus.coffeeshop.domain.voucher;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 바우처 사용 이력 (주문 단위, append-only)
 */
@Entity
@Table(name = "voucher_redemptions",
        indexes = @Index(name = "idx_voucher_redemptions_voucher", columnList = "voucher_id"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoucherRedemption {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "voucher_redemption_id")
    private Long voucherRedemptionId;

    @Column(name = "voucher_id", nullable = false)
    private Long voucherId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "discount_amount", nullable = false)
    private Long discountAmount;

    @Column(name = "used_at", nullable = false)
    private LocalDateTime usedAt;

    public static VoucherRedemption of(Long voucherId, Long userId, Long orderId, long discountAmount, LocalDateTime usedAt) {
        return VoucherRedemption.builder()
                .voucherId(voucherId)
                .userId(userId)
                .orderId(orderId)
                .discountAmount(discountAmount)
                .usedAt(usedAt)
                .build();
    }
}
