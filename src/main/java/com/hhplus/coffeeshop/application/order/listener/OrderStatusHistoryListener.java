package com.hhplus.coffeeshop.application.order.listener;

import com.hhplus.coffeeshop.application.alert.AlertService;
import com.hhplus.coffeeshop.domain.order.OrderRepository;
import com.hhplus.coffeeshop.domain.order.OrderStatusHistory;
import com.hhplus.coffeeshop.domain.order.event.OrderStatusChangedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 관리자 상태 변경 이력 기록 (사용자 취소는 기록하지 않음)
 */
@Slf4j
@Component
public class OrderStatusHistoryListener {

    private final OrderRepository orderRepository;
    private final AlertService alertService;

    public OrderStatusHistoryListener(OrderRepository orderRepository, AlertService alertService) {
        this.orderRepository = orderRepository;
        this.alertService = alertService;
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void handleStatusChanged(OrderStatusChangedEvent event) {
        if (!event.isAdminAction()) {
            return;
        }
        try {
            orderRepository.saveHistory(OrderStatusHistory.of(
                    event.getOrderId(), event.getPreviousStatus(), event.getNewStatus(),
                    event.getActorAdminId(), event.getNotes(), event.getOccurredAt()));
        } catch (Exception e) {
            log.error("[OrderStatusHistoryListener] 변경 이력 기록 실패 - orderId={}, adminId={}, error={}",
                    event.getOrderId(), event.getActorAdminId(), e.getMessage(), e);
            alertService.notifyStatusHistoryFailure(event.getOrderId(), event.getActorAdminId(),
                    event.getNewStatus().name(), e.getMessage());
        }
    }
}
