package com.hhplus.coffeeshop.infrastructure.persistence.notification;

import com.hhplus.coffeeshop.domain.notification.Notification;
import com.hhplus.coffeeshop.domain.notification.NotificationRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
@Primary
@Transactional
public class MySQLNotificationRepository implements NotificationRepository {

    private final NotificationJpaRepository notificationJpaRepository;

    public MySQLNotificationRepository(NotificationJpaRepository notificationJpaRepository) {
        this.notificationJpaRepository = notificationJpaRepository;
    }

    @Override
    public Notification save(Notification notification) {
        return notificationJpaRepository.save(notification);
    }

    @Override
    public Optional<Notification> findById(Long notificationId) {
        return notificationJpaRepository.findById(notificationId);
    }

    @Override
    public List<Notification> findByUserId(Long userId) {
        return notificationJpaRepository.findByUserIdOrderByCreatedAtDescNotificationIdDesc(userId);
    }

    @Override
    public long countUnreadByUserId(Long userId) {
        return notificationJpaRepository.countByUserIdAndIsReadFalse(userId);
    }
}
