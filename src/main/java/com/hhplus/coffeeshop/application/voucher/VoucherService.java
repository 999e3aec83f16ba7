package com.hhplus.coffeeshop.application.voucher;

import com.hhplus.coffeeshop.application.voucher.dto.VoucherCheckResult;
import com.hhplus.coffeeshop.application.voucher.dto.VoucherView;
import com.hhplus.coffeeshop.domain.voucher.Voucher;
import com.hhplus.coffeeshop.domain.voucher.VoucherNotFoundException;
import com.hhplus.coffeeshop.domain.voucher.VoucherPolicy;
import com.hhplus.coffeeshop.domain.voucher.VoucherRedemption;
import com.hhplus.coffeeshop.domain.voucher.VoucherRejectedException;
import com.hhplus.coffeeshop.domain.voucher.VoucherRepository;
import com.hhplus.coffeeshop.domain.voucher.VoucherUsage;
import com.hhplus.coffeeshop.domain.voucher.VoucherValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * VoucherService - 바우처 검증/사용 (Application 계층)
 *
 * 핵심 비즈니스 규칙:
 * - 코드는 대문자로 정규화하여 조회
 * - 검증 실패는 예외가 아닌 VoucherValidationResult 값으로 반환
 * - 주문 생성 시 검증과 사용 처리는 같은 비관적 락 범위(주문 트랜잭션) 안에서 수행
 *
 * 동시성 제어:
 * - validateForRedemption(): SELECT ... FOR UPDATE로 바우처 행을 잠그고 검증
 * - redeem(): 같은 트랜잭션에서 전체/사용자별 사용 횟수 증가 + 사용 이력 기록
 */
@Slf4j
@Service
public class VoucherService {

    private final VoucherRepository voucherRepository;
    private final VoucherPolicy voucherPolicy;

    public VoucherService(VoucherRepository voucherRepository, VoucherPolicy voucherPolicy) {
        this.voucherRepository = voucherRepository;
        this.voucherPolicy = voucherPolicy;
    }

    /**
     * 바우처 검증 (잠금 없음, 조회/미리보기용)
     */
    @Transactional(readOnly = true)
    public VoucherValidationResult validate(Long userId, String code, long subtotal) {
        Voucher voucher = voucherRepository.findByCode(Voucher.normalizeCode(code)).orElse(null);
        return evaluate(userId, voucher, subtotal);
    }

    /**
     * 검증 결과와 예상 할인액
     */
    @Transactional(readOnly = true)
    public VoucherCheckResult check(Long userId, String code, long subtotal) {
        VoucherValidationResult result = validate(userId, code, subtotal);
        long discount = result.isOk() ? voucherPolicy.computeDiscount(subtotal, result.getVoucher()) : 0L;
        return VoucherCheckResult.of(Voucher.normalizeCode(code), subtotal, result, discount);
    }

    /**
     * 명시적 바우처 적용 요청
     *
     * @throws VoucherRejectedException 검증 실패 (400)
     */
    @Transactional(readOnly = true)
    public VoucherCheckResult apply(Long userId, String code, long subtotal) {
        VoucherCheckResult result = check(userId, code, subtotal);
        if (!result.isOk()) {
            throw new VoucherRejectedException(result.getCode(), result.getRejection(), result.getReason());
        }
        return result;
    }

    public long computeDiscount(long subtotal, Voucher voucher) {
        return voucherPolicy.computeDiscount(subtotal, voucher);
    }

    /**
     * 코드로 바우처 조회
     *
     * @throws VoucherNotFoundException 존재하지 않는 코드
     */
    @Transactional(readOnly = true)
    public VoucherView lookup(String code) {
        String normalized = Voucher.normalizeCode(code);
        return voucherRepository.findByCode(normalized)
                .map(VoucherView::from)
                .orElseThrow(() -> new VoucherNotFoundException(normalized));
    }

    /**
     * 사용자가 지금 사용할 수 있는 바우처 목록
     *
     * @param subtotal null이면 최소 주문 금액 조건을 확인하지 않음
     */
    @Transactional(readOnly = true)
    public List<VoucherView> availableFor(Long userId, Long subtotal) {
        LocalDateTime now = LocalDateTime.now();
        return voucherRepository.findUsableAt(now).stream()
                .filter(Voucher::hasRemainingUsage)
                .filter(voucher -> voucher.allowsUserUsage(timesUsed(userId, voucher.getVoucherId())))
                .filter(voucher -> subtotal == null || voucher.meetsMinimumOrder(subtotal))
                .map(VoucherView::from)
                .collect(Collectors.toList());
    }

    /**
     * 주문 트랜잭션 안에서 바우처 행을 잠그고 검증
     * 반드시 호출자의 트랜잭션 안에서 실행되어야 합니다.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public VoucherValidationResult validateForRedemption(Long userId, String code, long subtotal) {
        Voucher voucher = voucherRepository.findByCodeForUpdate(Voucher.normalizeCode(code)).orElse(null);
        return evaluate(userId, voucher, subtotal);
    }

    /**
     * 바우처 사용 처리
     *
     * - 전체 사용 횟수 증가
     * - voucher_usage(user, voucher) upsert (times_used 증가, last_used_at 기록)
     * - voucher_redemptions 이력 추가
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void redeem(Long voucherId, Long userId, Long orderId, long discountAmount) {
        Voucher voucher = voucherRepository.findById(voucherId)
                .orElseThrow(() -> new VoucherNotFoundException("id=" + voucherId));
        LocalDateTime now = LocalDateTime.now();

        voucher.increaseUsage();
        voucherRepository.save(voucher);

        VoucherUsage usage = voucherRepository.findUsage(userId, voucherId)
                .orElseGet(() -> VoucherUsage.first(userId, voucherId));
        usage.recordUse(now);
        voucherRepository.saveUsage(usage);

        voucherRepository.saveRedemption(VoucherRedemption.of(voucherId, userId, orderId, discountAmount, now));

        log.info("[VoucherService] 바우처 사용 - code={}, userId={}, orderId={}, discount={}, usage={}/{}",
                voucher.getCode(), userId, orderId, discountAmount, voucher.getCurrentUsage(), voucher.getUsageLimit());
    }

    private VoucherValidationResult evaluate(Long userId, Voucher voucher, long subtotal) {
        int timesUsed = voucher == null ? 0 : timesUsed(userId, voucher.getVoucherId());
        return voucherPolicy.validate(voucher, timesUsed, subtotal, LocalDateTime.now());
    }

    private int timesUsed(Long userId, Long voucherId) {
        return voucherRepository.findUsage(userId, voucherId)
                .map(VoucherUsage::getTimesUsed)
                .orElse(0);
    }
}
