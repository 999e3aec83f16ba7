package com.hhplus.coffeeshop.presentation.notification.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.coffeeshop.application.notification.dto.NotificationView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationResponse {

    @JsonProperty("notification_id")
    private Long notificationId;

    @JsonProperty("order_id")
    private Long orderId;

    private String type;

    private String title;

    private String message;

    @JsonProperty("is_read")
    private Boolean isRead;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    public static NotificationResponse from(NotificationView view) {
        return NotificationResponse.builder()
                .notificationId(view.getNotificationId())
                .orderId(view.getOrderId())
                .type(view.getType().name())
                .title(view.getTitle())
                .message(view.getMessage())
                .isRead(view.isRead())
                .createdAt(view.getCreatedAt())
                .build();
    }
}
