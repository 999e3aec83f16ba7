package com.hhplus.coffeeshop.presentation.notification;

import com.hhplus.coffeeshop.application.notification.NotificationService;
import com.hhplus.coffeeshop.presentation.notification.response.NotificationResponse;
import com.hhplus.coffeeshop.presentation.notification.response.UnreadCountResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * NotificationController - 사용자 알림 API
 */
@RestController
@RequestMapping("/notifications")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public ResponseEntity<List<NotificationResponse>> list(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(notificationService.listForUser(userId).stream()
                .map(NotificationResponse::from)
                .collect(Collectors.toList()));
    }

    @GetMapping("/unread-count")
    public ResponseEntity<UnreadCountResponse> unreadCount(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(new UnreadCountResponse(notificationService.unreadCount(userId)));
    }

    @PutMapping("/{notification_id}/read")
    public ResponseEntity<NotificationResponse> markRead(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("notification_id") Long notificationId) {
        return ResponseEntity.ok(NotificationResponse.from(notificationService.markRead(userId, notificationId)));
    }
}
