package com.hhplus.coffeeshop.application.order.listener;

import com.hhplus.coffeeshop.application.alert.AlertService;
import com.hhplus.coffeeshop.application.loyalty.LoyaltyService;
import com.hhplus.coffeeshop.domain.order.event.OrderCreatedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 주문 커밋 이후 포인트 적립
 *
 * 주문은 이미 커밋되었으므로 적립 실패가 주문 생성 응답을 실패시키지 않아야 합니다.
 * 실패 건은 loyalty_credit_failures에 기록되어 재처리 대상이 됩니다.
 */
@Slf4j
@Component
public class LoyaltyCreditEventListener {

    private final LoyaltyService loyaltyService;
    private final AlertService alertService;

    public LoyaltyCreditEventListener(LoyaltyService loyaltyService, AlertService alertService) {
        this.loyaltyService = loyaltyService;
        this.alertService = alertService;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleOrderCreated(OrderCreatedEvent event) {
        try {
            long points = loyaltyService.creditForOrder(
                    event.getUserId(), event.getOrderId(), event.getOrderNumber(), event.getTotalAmount());
            log.info("[LoyaltyCreditEventListener] 포인트 적립 - orderId={}, userId={}, points={}",
                    event.getOrderId(), event.getUserId(), points);
        } catch (Exception e) {
            log.error("[LoyaltyCreditEventListener] 포인트 적립 실패 - orderId={}, userId={}, error={}",
                    event.getOrderId(), event.getUserId(), e.getMessage(), e);
            recordFailure(event, e);
        }
    }

    private void recordFailure(OrderCreatedEvent event, Exception cause) {
        try {
            loyaltyService.recordCreditFailure(event.getUserId(), event.getOrderId(), event.getOrderNumber(),
                    event.getTotalAmount(), cause.getMessage());
            alertService.notifyLoyaltyCreditFailure(event.getOrderId(), event.getUserId(),
                    event.getTotalAmount(), cause.getMessage());
        } catch (Exception e) {
            log.error("[LoyaltyCreditEventListener] 적립 실패 기록 실패 - orderId={}, userId={}, error={}",
                    event.getOrderId(), event.getUserId(), e.getMessage(), e);
            alertService.notifyLoyaltyFailureNotRecorded(event.getOrderId(), event.getUserId(),
                    event.getTotalAmount(), cause.getMessage());
        }
    }
}
