package com.hhplus.coffeeshop.application.notification.listener;

import com.hhplus.coffeeshop.application.alert.AlertService;
import com.hhplus.coffeeshop.application.notification.NotificationService;
import com.hhplus.coffeeshop.domain.order.event.OrderStatusChangedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Slf4j
@Component
public class NotificationEventListener {

    private final NotificationService notificationService;
    private final AlertService alertService;

    public NotificationEventListener(NotificationService notificationService, AlertService alertService) {
        this.notificationService = notificationService;
        this.alertService = alertService;
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void handleStatusChanged(OrderStatusChangedEvent event) {
        try {
            notificationService.createOrderUpdate(
                    event.getUserId(), event.getOrderId(), event.getOrderNumber(), event.getNewStatus());
            log.info("[NotificationEventListener] 주문 상태 알림 생성 - orderId={}, userId={}, status={}",
                    event.getOrderId(), event.getUserId(), event.getNewStatus());
        } catch (Exception e) {
            log.error("[NotificationEventListener] 주문 상태 알림 생성 실패 - orderId={}, userId={}, error={}",
                    event.getOrderId(), event.getUserId(), e.getMessage(), e);
            alertService.notifyNotificationFailure(event.getOrderId(), event.getUserId(),
                    event.getNewStatus().name(), e.getMessage());
        }
    }
}
