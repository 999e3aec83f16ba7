package com.hhplus.coffeeshop.domain.notification;

public enum NotificationType {
    ORDER_UPDATE,
    PROMOTION,
    SYSTEM
}
