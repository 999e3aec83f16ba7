package com.hhplus.coffeeshop.domain.voucher;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 바우처 저장소 포트
 */
public interface VoucherRepository {

    Optional<Voucher> findByCode(String normalizedCode);

    /**
     * 비관적 락(SELECT ... FOR UPDATE)으로 조회
     * 검증과 사용 횟수 증가를 같은 락 범위에서 수행하기 위해 사용합니다.
     */
    Optional<Voucher> findByCodeForUpdate(String normalizedCode);

    Optional<Voucher> findById(Long voucherId);

    Voucher save(Voucher voucher);

    /**
     * 활성 상태이고 기간 안에 있는 바우처
     */
    List<Voucher> findUsableAt(LocalDateTime now);

    Optional<VoucherUsage> findUsage(Long userId, Long voucherId);

    List<VoucherUsage> findUsagesByUserId(Long userId);

    VoucherUsage saveUsage(VoucherUsage usage);

    VoucherRedemption saveRedemption(VoucherRedemption redemption);

    List<VoucherRedemption> findRedemptionsByVoucherId(Long voucherId);
}
