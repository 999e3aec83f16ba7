package com.hhplus.coffeeshop.application.notification;

import com.hhplus.coffeeshop.application.notification.dto.NotificationView;
import com.hhplus.coffeeshop.domain.notification.Notification;
import com.hhplus.coffeeshop.domain.notification.NotificationNotFoundException;
import com.hhplus.coffeeshop.domain.notification.NotificationRepository;
import com.hhplus.coffeeshop.domain.order.OrderStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 사용자 알림 서비스
 */
@Service
public class NotificationService {

    private final NotificationRepository notificationRepository;

    public NotificationService(NotificationRepository notificationRepository) {
        this.notificationRepository = notificationRepository;
    }

    @Transactional
    public NotificationView createOrderUpdate(Long userId, Long orderId, String orderNumber, OrderStatus newStatus) {
        Notification saved = notificationRepository.save(
                Notification.orderUpdate(userId, orderId, orderNumber, newStatus));
        return NotificationView.from(saved);
    }

    @Transactional(readOnly = true)
    public List<NotificationView> listForUser(Long userId) {
        return notificationRepository.findByUserId(userId).stream()
                .map(NotificationView::from)
                .collect(Collectors.toList());
    }

    /**
     * 읽음 처리 (다른 사용자의 알림은 존재하지 않는 것으로 취급)
     */
    @Transactional
    public NotificationView markRead(Long userId, Long notificationId) {
        Notification notification = notificationRepository.findById(notificationId)
                .filter(n -> n.isOwnedBy(userId))
                .orElseThrow(() -> new NotificationNotFoundException(notificationId));
        notification.markRead();
        return NotificationView.from(notificationRepository.save(notification));
    }

    @Transactional(readOnly = true)
    public long unreadCount(Long userId) {
        return notificationRepository.countUnreadByUserId(userId);
    }
}
