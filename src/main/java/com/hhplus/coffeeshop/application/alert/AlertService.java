package com.hhplus.coffeeshop.application.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * AlertService - 운영자 알림 서비스 (Application 계층)
 *
 * 역할:
 * - 커밋 이후 부수 효과가 실패해 수동 확인이 필요한 경우 운영자 알림 발송
 *
 * 현재 구현:
 * - 로깅 기반 알림 ([ALERT] 접두어로 로그 수집기에서 필터링)
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    /**
     * 주문 커밋 후 포인트 적립 실패 알림
     *
     * loyalty_credit_failures에 기록되며 재처리 API로 복구할 수 있습니다.
     */
    public void notifyLoyaltyCreditFailure(Long orderId, Long userId, long totalAmount, String reason) {
        log.error("[ALERT][포인트 적립 실패] 주문 ID: {}, 사용자 ID: {}, 결제 금액: {}원, 원인: {} - 재처리 필요",
                orderId, userId, totalAmount, reason);
    }

    /**
     * 적립 실패 기록조차 저장하지 못한 경우 (수동 개입 필요)
     */
    public void notifyLoyaltyFailureNotRecorded(Long orderId, Long userId, long totalAmount, String reason) {
        log.error("[ALERT][포인트 적립 실패 기록 불가 - 긴급] 주문 ID: {}, 사용자 ID: {}, 결제 금액: {}원, 원인: {} - 즉시 수동 개입 필요",
                orderId, userId, totalAmount, reason);
    }

    /**
     * 주문 상태 알림 저장 실패
     */
    public void notifyNotificationFailure(Long orderId, Long userId, String status, String reason) {
        log.error("[ALERT][알림 저장 실패] 주문 ID: {}, 사용자 ID: {}, 상태: {}, 원인: {}",
                orderId, userId, status, reason);
    }

    /**
     * 관리자 상태 변경 이력 저장 실패
     */
    public void notifyStatusHistoryFailure(Long orderId, Long adminId, String status, String reason) {
        log.error("[ALERT][상태 이력 저장 실패] 주문 ID: {}, 관리자 ID: {}, 상태: {}, 원인: {}",
                orderId, adminId, status, reason);
    }
}
