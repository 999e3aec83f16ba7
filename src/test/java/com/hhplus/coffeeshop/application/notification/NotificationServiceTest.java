package com.hhplus.coffeeshop.application.notification;

import com.hhplus.coffeeshop.application.notification.dto.NotificationView;
import com.hhplus.coffeeshop.domain.notification.Notification;
import com.hhplus.coffeeshop.domain.notification.NotificationNotFoundException;
import com.hhplus.coffeeshop.domain.notification.NotificationRepository;
import com.hhplus.coffeeshop.domain.order.OrderStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationService 단위 테스트")
class NotificationServiceTest {

    @Mock
    private NotificationRepository notificationRepository;

    @InjectMocks
    private NotificationService notificationService;

    @Test
    @DisplayName("주문 상태 알림 제목에는 주문번호가 들어간다")
    void createOrderUpdate() {
        when(notificationRepository.save(any(Notification.class))).thenAnswer(invocation -> invocation.getArgument(0));

        NotificationView view = notificationService.createOrderUpdate(1L, 77L, "ORD-20250601-ABC123", OrderStatus.READY);

        assertThat(view.getTitle()).isEqualTo("주문 업데이트 #ORD-20250601-ABC123");
        assertThat(view.getMessage()).isNotBlank();
        assertThat(view.isRead()).isFalse();
    }

    @Test
    @DisplayName("다른 사용자의 알림은 읽음 처리할 수 없다")
    void markReadOtherUser() {
        Notification notification = Notification.orderUpdate(2L, 77L, "ORD-1", OrderStatus.CONFIRMED);
        when(notificationRepository.findById(3L)).thenReturn(Optional.of(notification));

        assertThatThrownBy(() -> notificationService.markRead(1L, 3L))
                .isInstanceOf(NotificationNotFoundException.class);
        assertThat(notification.getIsRead()).isFalse();
    }

    @Test
    @DisplayName("본인 알림은 읽음 처리된다")
    void markRead() {
        Notification notification = Notification.orderUpdate(1L, 77L, "ORD-1", OrderStatus.CONFIRMED);
        when(notificationRepository.findById(3L)).thenReturn(Optional.of(notification));
        when(notificationRepository.save(notification)).thenReturn(notification);

        NotificationView view = notificationService.markRead(1L, 3L);

        assertThat(view.isRead()).isTrue();
    }
}
