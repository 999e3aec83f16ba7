package com.hhplus.coffeeshop.application.loyalty;

import com.hhplus.coffeeshop.application.loyalty.dto.LoyaltyAccountView;
import com.hhplus.coffeeshop.application.loyalty.dto.LoyaltyTransactionView;
import com.hhplus.coffeeshop.domain.loyalty.InsufficientPointsException;
import com.hhplus.coffeeshop.domain.loyalty.LoyaltyCreditFailure;
import com.hhplus.coffeeshop.domain.loyalty.LoyaltyPolicy;
import com.hhplus.coffeeshop.domain.loyalty.LoyaltyRepository;
import com.hhplus.coffeeshop.domain.loyalty.LoyaltyTransaction;
import com.hhplus.coffeeshop.domain.user.User;
import com.hhplus.coffeeshop.domain.user.UserNotFoundException;
import com.hhplus.coffeeshop.domain.user.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * LoyaltyService - 포인트 원장 (Application 계층)
 *
 * 핵심 비즈니스 규칙:
 * - 잔액은 항상 원장(loyalty_transactions) delta 합계와 같음
 * - 잔액 변경, 등급 재계산, 원장 기록은 한 트랜잭션에서 처리
 * - 사용(redeem)과 관리자 조정으로 잔액이 음수가 될 수 없음
 * - 주문 적립은 주문당 한 번 (멱등)
 *
 * 동시성 제어:
 * - 사용자 행 비관적 락 (SELECT ... FOR UPDATE)
 */
@Slf4j
@Service
public class LoyaltyService {

    private final UserRepository userRepository;
    private final LoyaltyRepository loyaltyRepository;
    private final LoyaltyPolicy loyaltyPolicy;

    public LoyaltyService(UserRepository userRepository,
                          LoyaltyRepository loyaltyRepository,
                          LoyaltyPolicy loyaltyPolicy) {
        this.userRepository = userRepository;
        this.loyaltyRepository = loyaltyRepository;
        this.loyaltyPolicy = loyaltyPolicy;
    }

    // ========== 적립 / 사용 / 조정 ==========

    @Transactional
    public LoyaltyAccountView credit(Long userId, long points, String description, Long orderId) {
        return applyCredit(userId, lockUser(userId), points, description, orderId);
    }

    private LoyaltyAccountView applyCredit(Long userId, User user, long points, String description, Long orderId) {
        boolean tierChanged = user.getLoyalty().credit(points, loyaltyPolicy);
        user.touch();
        userRepository.save(user);
        loyaltyRepository.saveTransaction(
                LoyaltyTransaction.earn(userId, points, description, orderId, user.getLoyalty().balance()));

        log.info("[LoyaltyService] 포인트 적립 - userId={}, points={}, balance={}, tier={}, orderId={}",
                userId, points, user.getLoyalty().balance(), user.getLoyalty().getTier(), orderId);
        return LoyaltyAccountView.of(user, tierChanged);
    }

    /**
     * 포인트 사용
     *
     * @throws InsufficientPointsException 잔액 부족
     */
    @Transactional
    public LoyaltyAccountView debit(Long userId, long points, String description) {
        User user = lockUser(userId);
        boolean tierChanged = user.getLoyalty().debit(userId, points, loyaltyPolicy);
        user.touch();
        userRepository.save(user);
        loyaltyRepository.saveTransaction(
                LoyaltyTransaction.redeem(userId, points, description, user.getLoyalty().balance()));

        log.info("[LoyaltyService] 포인트 사용 - userId={}, points={}, balance={}", userId, points, user.getLoyalty().balance());
        return LoyaltyAccountView.of(user, tierChanged);
    }

    /**
     * 관리자 포인트 조정 (부호 있는 delta)
     */
    @Transactional
    public LoyaltyAccountView adjust(Long userId, long delta, String description, Long adminId) {
        User user = lockUser(userId);
        boolean tierChanged = user.getLoyalty().adjust(userId, delta, loyaltyPolicy);
        user.touch();
        userRepository.save(user);
        loyaltyRepository.saveTransaction(
                LoyaltyTransaction.adjustment(userId, delta, description, adminId, user.getLoyalty().balance()));

        log.info("[LoyaltyService] 관리자 포인트 조정 - userId={}, delta={}, adminId={}, balance={}",
                userId, delta, adminId, user.getLoyalty().balance());
        return LoyaltyAccountView.of(user, tierChanged);
    }

    // ========== 조회 ==========

    @Transactional(readOnly = true)
    public LoyaltyAccountView account(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
        return LoyaltyAccountView.of(user, false);
    }

    /**
     * 포인트 내역 (최신순)
     */
    @Transactional(readOnly = true)
    public List<LoyaltyTransactionView> history(Long userId) {
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
        return loyaltyRepository.findTransactionsByUserId(userId).stream()
                .map(LoyaltyTransactionView::from)
                .collect(Collectors.toList());
    }

    // ========== 주문 적립 (커밋 이후) ==========

    /**
     * 주문 결제 금액 기준 포인트 적립
     *
     * 주문 트랜잭션과 분리된 새 트랜잭션에서 실행되며,
     * 일시적인 DB 오류는 최대 3회까지 재시도합니다.
     * 중복 적립 확인은 사용자 행 락을 잡은 뒤에 합니다.
     *
     * @return 적립 포인트 (이미 적립된 주문이거나 적립 포인트가 0이면 0)
     */
    @Retryable(
            retryFor = TransientDataAccessException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 100, multiplier = 2, maxDelay = 1000, random = true)
    )
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public long creditForOrder(Long userId, Long orderId, String orderNumber, long totalAmount) {
        long points = loyaltyPolicy.pointsFor(totalAmount);
        if (points <= 0) {
            log.debug("[LoyaltyService] 적립 포인트 없음 - orderId={}, totalAmount={}", orderId, totalAmount);
            return 0L;
        }
        User user = lockUser(userId);
        if (loyaltyRepository.existsEarnForOrder(orderId)) {
            log.info("[LoyaltyService] 이미 적립된 주문 - orderId={}", orderId);
            return 0L;
        }
        applyCredit(userId, user, points, "주문 적립 #" + orderNumber, orderId);
        return points;
    }

    /**
     * 적립 실패 기록 (재처리 대상)
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordCreditFailure(Long userId, Long orderId, String orderNumber, long totalAmount, String reason) {
        loyaltyRepository.saveFailure(LoyaltyCreditFailure.of(userId, orderId, orderNumber, totalAmount, reason));
        log.warn("[LoyaltyService] 적립 실패 기록 - userId={}, orderId={}, reason={}", userId, orderId, reason);
    }

    @Transactional(readOnly = true)
    public List<LoyaltyCreditFailure> unresolvedFailures() {
        return loyaltyRepository.findUnresolvedFailures();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailureResolved(LoyaltyCreditFailure failure) {
        failure.markResolved();
        loyaltyRepository.saveFailure(failure);
    }

    private User lockUser(Long userId) {
        return userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
    }
}
