package com.hhplus.coffeeshop.domain.notification;

import com.hhplus.coffeeshop.common.exception.DomainException;
import com.hhplus.coffeeshop.common.exception.ErrorCode;

public class NotificationNotFoundException extends DomainException {

    public NotificationNotFoundException(Long notificationId) {
        super(ErrorCode.NOTIFICATION_NOT_FOUND, String.format("ID: %d", notificationId));
    }
}
