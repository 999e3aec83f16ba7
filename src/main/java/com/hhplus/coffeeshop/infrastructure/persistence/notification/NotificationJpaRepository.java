package com.hhplus.coffeeshop.infrastructure.persistence.notification;

import com.hhplus.coffeeshop.domain.notification.Notification;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Notification JPA Repository
 */
public interface NotificationJpaRepository extends JpaRepository<Notification, Long> {

    List<Notification> findByUserIdOrderByCreatedAtDescNotificationIdDesc(Long userId);

    long countByUserIdAndIsReadFalse(Long userId);
}
