package com.hhplus.coffeeshop.domain.notification;

import java.util.List;
import java.util.Optional;

public interface NotificationRepository {

    Notification save(Notification notification);

    Optional<Notification> findById(Long notificationId);

    /**
     * 사용자 알림 (최신순)
     */
    List<Notification> findByUserId(Long userId);

    long countUnreadByUserId(Long userId);
}
