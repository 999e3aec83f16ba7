package com.hhplus.coffeeshop.domain.voucher;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * VoucherPolicy - 바우처 검증 및 할인액 계산 Domain Service
 *
 * 책임:
 * - 주문 금액, 사용 기간, 사용 한도 기준 바우처 검증
 * - 할인액 계산 (주문 금액을 넘지 않음)
 *
 * 바우처와 사용자별 사용 횟수는 호출자가 조회해 전달합니다.
 * 미리보기와 락을 잡은 차감 모두 같은 규칙을 사용합니다.
 */
public class VoucherPolicy {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * 아래 순서로 검사하고 첫 실패에서 멈춥니다.
     * 존재 여부 → 활성/기간 → 최소 주문 금액 → 전체 사용 한도 → 사용자별 한도
     *
     * @param voucher         정규화된 코드로 조회한 바우처 (없으면 null)
     * @param timesUsedByUser 해당 사용자의 사용 횟수
     * @param subtotal        장바구니 소계
     * @param now             검증 기준 시각
     */
    public VoucherValidationResult validate(Voucher voucher, int timesUsedByUser, long subtotal, LocalDateTime now) {
        if (voucher == null) {
            return VoucherValidationResult.rejected(VoucherRejection.NOT_FOUND, null);
        }
        if (!voucher.isUsableAt(now)) {
            return VoucherValidationResult.rejected(VoucherRejection.INACTIVE, voucher);
        }
        if (!voucher.meetsMinimumOrder(subtotal)) {
            return VoucherValidationResult.rejected(
                    VoucherRejection.BELOW_MIN_ORDER,
                    String.format("최소 주문 금액 %,d원 이상부터 사용할 수 있습니다", voucher.getMinOrderAmount()),
                    voucher);
        }
        if (!voucher.hasRemainingUsage()) {
            return VoucherValidationResult.rejected(VoucherRejection.USAGE_LIMIT_REACHED, voucher);
        }
        if (!voucher.allowsUserUsage(timesUsedByUser)) {
            return VoucherValidationResult.rejected(VoucherRejection.USER_LIMIT_REACHED, voucher);
        }
        return VoucherValidationResult.accepted(voucher);
    }

    /**
     * 할인액 계산
     * - 비율: floor(소계 * 값 / 100), 최대 할인액이 있으면 그 이하
     * - 정액: 할인 값
     * 결과는 0 이상 소계 이하로 제한합니다.
     */
    public long computeDiscount(long subtotal, Voucher voucher) {
        if (voucher == null || subtotal <= 0) {
            return 0L;
        }

        long discount;
        if (voucher.getDiscountType() == DiscountType.PERCENTAGE) {
            discount = BigDecimal.valueOf(subtotal)
                    .multiply(voucher.getDiscountValue())
                    .divide(HUNDRED, 0, RoundingMode.DOWN)
                    .longValue();
            if (voucher.getMaxDiscountAmount() != null) {
                discount = Math.min(discount, voucher.getMaxDiscountAmount());
            }
        } else {
            discount = voucher.getDiscountValue().setScale(0, RoundingMode.DOWN).longValue();
        }

        return Math.max(0L, Math.min(discount, subtotal));
    }
}
