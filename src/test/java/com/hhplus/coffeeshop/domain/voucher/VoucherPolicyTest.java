package com.hhplus.coffeeshop.domain.voucher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("VoucherPolicy 검증/할인 계산 테스트")
class VoucherPolicyTest {

    private final VoucherPolicy policy = new VoucherPolicy();
    private final LocalDateTime now = LocalDateTime.of(2025, 6, 1, 12, 0);

    private Voucher percentage(String value, Long min, Long cap, Integer limit, Integer perUser) {
        return Voucher.create("save10", DiscountType.PERCENTAGE, new BigDecimal(value), min, cap, limit, perUser,
                now.minusDays(1), now.plusDays(1));
    }

    @Nested
    @DisplayName("검증")
    class Validate {

        @Test
        @DisplayName("존재하지 않는 바우처는 NOT_FOUND")
        void notFound() {
            VoucherValidationResult result = policy.validate(null, 0, 10_000L, now);

            assertThat(result.isOk()).isFalse();
            assertThat(result.getRejection()).isEqualTo(VoucherRejection.NOT_FOUND);
        }

        @Test
        @DisplayName("기간 밖이거나 비활성화된 바우처는 INACTIVE")
        void inactive() {
            Voucher expired = Voucher.create("OLD", DiscountType.FIXED, new BigDecimal("1000"), null, null, null, null,
                    now.minusDays(10), now.minusDays(1));
            Voucher disabled = percentage("10", null, null, null, null);
            disabled.deactivate();

            assertThat(policy.validate(expired, 0, 10_000L, now).getRejection()).isEqualTo(VoucherRejection.INACTIVE);
            assertThat(policy.validate(disabled, 0, 10_000L, now).getRejection()).isEqualTo(VoucherRejection.INACTIVE);
        }

        @Test
        @DisplayName("최소 주문 금액 미달이면 BELOW_MIN_ORDER와 금액 안내 문구를 반환한다")
        void belowMinimum() {
            VoucherValidationResult result = policy.validate(percentage("10", 30_000L, null, null, null), 0, 29_999L, now);

            assertThat(result.getRejection()).isEqualTo(VoucherRejection.BELOW_MIN_ORDER);
            assertThat(result.getReason()).contains("30,000");
        }

        @Test
        @DisplayName("전체 사용 횟수가 소진되면 USAGE_LIMIT_REACHED")
        void usageLimit() {
            Voucher voucher = percentage("10", null, null, 1, null);
            voucher.increaseUsage();

            assertThat(policy.validate(voucher, 0, 10_000L, now).getRejection())
                    .isEqualTo(VoucherRejection.USAGE_LIMIT_REACHED);
        }

        @Test
        @DisplayName("사용자별 횟수를 모두 사용하면 USER_LIMIT_REACHED")
        void perUserLimit() {
            assertThat(policy.validate(percentage("10", null, null, null, 1), 1, 10_000L, now).getRejection())
                    .isEqualTo(VoucherRejection.USER_LIMIT_REACHED);
        }

        @Test
        @DisplayName("모든 조건을 만족하면 승인된다")
        void accepted() {
            VoucherValidationResult result = policy.validate(percentage("10", 0L, null, 100, 1), 0, 55_000L, now);

            assertThat(result.isOk()).isTrue();
            assertThat(result.getVoucher().getCode()).isEqualTo("SAVE10");
        }
    }

    @Nested
    @DisplayName("할인액 계산")
    class ComputeDiscount {

        @Test
        @DisplayName("비율 할인은 내림 처리한다")
        void percentageFloors() {
            assertThat(policy.computeDiscount(55_000L, percentage("10", null, null, null, null))).isEqualTo(5_500L);
            assertThat(policy.computeDiscount(12_345L, percentage("10", null, null, null, null))).isEqualTo(1_234L);
        }

        @Test
        @DisplayName("비율 할인은 최대 할인액을 넘지 않는다")
        void percentageCapped() {
            assertThat(policy.computeDiscount(200_000L, percentage("20", null, 15_000L, null, null))).isEqualTo(15_000L);
        }

        @Test
        @DisplayName("정액 할인은 주문 금액을 넘지 않는다")
        void fixedClampedToSubtotal() {
            Voucher fixed = Voucher.create("FIXED", DiscountType.FIXED, new BigDecimal("20000"), null, null, null, null, null, null);

            assertThat(policy.computeDiscount(50_000L, fixed)).isEqualTo(20_000L);
            assertThat(policy.computeDiscount(8_000L, fixed)).isEqualTo(8_000L);
        }
    }

    @Test
    @DisplayName("비율 할인 값이 100을 넘으면 생성할 수 없다")
    void rejectsPercentageOver100() {
        assertThatThrownBy(() -> percentage("120", null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
