package com.hhplus.coffeeshop.domain.voucher;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 사용자별 바우처 사용 횟수 (user, voucher) → times_used
 *
 * 전체 사용 횟수와 같은 트랜잭션에서 증가하며 감소하지 않습니다.
 */
@Entity
@Table(name = "voucher_usage",
        uniqueConstraints = @UniqueConstraint(name = "uk_voucher_usage_user_voucher", columnNames = {"user_id", "voucher_id"}))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoucherUsage {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "voucher_usage_id")
    private Long voucherUsageId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "voucher_id", nullable = false)
    private Long voucherId;

    @Column(name = "times_used", nullable = false)
    private Integer timesUsed;

    @Column(name = "last_used_at")
    private LocalDateTime lastUsedAt;

    public static VoucherUsage first(Long userId, Long voucherId) {
        return VoucherUsage.builder()
                .userId(userId)
                .voucherId(voucherId)
                .timesUsed(0)
                .build();
    }

    public void recordUse(LocalDateTime usedAt) {
        this.timesUsed = (this.timesUsed == null ? 0 : this.timesUsed) + 1;
        this.lastUsedAt = usedAt;
    }
}
