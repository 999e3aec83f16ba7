package com.hhplus.coffeeshop.domain.voucher;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Voucher 도메인 엔티티
 *
 * 관리자가 발행하는 전역 할인 코드입니다.
 * - code는 대문자로 정규화되어 저장되며 유일합니다
 * - 비율 할인 값은 0~100 범위
 * - current_usage는 주문 생성 트랜잭션 안에서 비관적 락으로 증가합니다
 * - version은 관리자 수정과의 충돌 감지용 낙관적 락
 */
@Entity
@Table(name = "vouchers",
        uniqueConstraints = @UniqueConstraint(name = "uk_voucher_code", columnNames = "code"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Voucher {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "voucher_id")
    private Long voucherId;

    @Column(name = "code", nullable = false, length = 50)
    private String code;

    @Column(name = "description")
    private String description;

    @Column(name = "discount_type", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private DiscountType discountType;

    @Column(name = "discount_value", nullable = false, precision = 12, scale = 2)
    private BigDecimal discountValue;

    @Column(name = "min_order_amount")
    private Long minOrderAmount;

    /** 비율 할인일 때만 의미가 있는 최대 할인액 */
    @Column(name = "max_discount_amount")
    private Long maxDiscountAmount;

    /** 전체 사용 가능 횟수 (null이면 무제한) */
    @Column(name = "usage_limit")
    private Integer usageLimit;

    /** 사용자별 사용 가능 횟수 (null이면 무제한) */
    @Column(name = "usage_per_user")
    @Builder.Default
    private Integer usagePerUser = 1;

    @Column(name = "current_usage", nullable = false)
    @Builder.Default
    private Integer currentUsage = 0;

    @Column(name = "starts_at")
    private LocalDateTime startsAt;

    @Column(name = "ends_at")
    private LocalDateTime endsAt;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    /**
     * 바우처 생성 팩토리 메서드
     *
     * @throws IllegalArgumentException 할인 값이 음수이거나 비율 할인이 100을 넘는 경우
     */
    public static Voucher create(String code, DiscountType discountType, BigDecimal discountValue,
                                 Long minOrderAmount, Long maxDiscountAmount,
                                 Integer usageLimit, Integer usagePerUser,
                                 LocalDateTime startsAt, LocalDateTime endsAt) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("바우처 코드는 필수입니다");
        }
        if (discountType == null || discountValue == null || discountValue.signum() < 0) {
            throw new IllegalArgumentException("할인 방식과 0 이상의 할인 값은 필수입니다");
        }
        if (discountType == DiscountType.PERCENTAGE && discountValue.compareTo(BigDecimal.valueOf(100)) > 0) {
            throw new IllegalArgumentException("비율 할인은 0~100 범위여야 합니다: " + discountValue);
        }
        return Voucher.builder()
                .code(normalizeCode(code))
                .discountType(discountType)
                .discountValue(discountValue)
                .minOrderAmount(minOrderAmount)
                .maxDiscountAmount(maxDiscountAmount)
                .usageLimit(usageLimit)
                .usagePerUser(usagePerUser)
                .currentUsage(0)
                .startsAt(startsAt)
                .endsAt(endsAt)
                .isActive(true)
                .createdAt(LocalDateTime.now())
                .build();
    }

    public static String normalizeCode(String code) {
        return code == null ? null : code.trim().toUpperCase();
    }

    /**
     * 활성 상태이며 사용 기간 [startsAt, endsAt] 안에 있는지 확인
     * 기간이 null이면 해당 방향으로 제한이 없습니다.
     */
    public boolean isUsableAt(LocalDateTime now) {
        if (!Boolean.TRUE.equals(isActive)) {
            return false;
        }
        if (startsAt != null && now.isBefore(startsAt)) {
            return false;
        }
        return endsAt == null || !now.isAfter(endsAt);
    }

    public boolean meetsMinimumOrder(long subtotal) {
        return minOrderAmount == null || subtotal >= minOrderAmount;
    }

    public boolean hasRemainingUsage() {
        return usageLimit == null || currentUsage < usageLimit;
    }

    public boolean allowsUserUsage(int timesUsedByUser) {
        return usagePerUser == null || timesUsedByUser < usagePerUser;
    }

    /**
     * 전체 사용 횟수 증가 (감소하지 않음)
     */
    public void increaseUsage() {
        this.currentUsage = (this.currentUsage == null ? 0 : this.currentUsage) + 1;
    }

    public void deactivate() {
        this.isActive = false;
    }
}
