package com.hhplus.hotel.application.notification;

import com.hhplus.hotel.domain.order.event.OrderPlacedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * OrderNotificationListenerTest - 알림 실패가 주문에 영향을 주지 않는지 검증
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OrderNotificationListener 단위 테스트")
class OrderNotificationListenerTest {

    @Mock
    private OrderNotificationSender notificationSender;

    private OrderNotificationListener listener;

    @BeforeEach
    void setup() {
        listener = new OrderNotificationListener(notificationSender);
    }

    private OrderPlacedEvent event(String email) {
        return new OrderPlacedEvent(1L, "ORD-20250601-1-ABCDEF12", "Jane Doe", "010-1234-5678", email,
                new BigDecimal("49.98"), "confirmed", List.of());
    }

    @Test
    @DisplayName("이메일이 있으면 고객/관리자 알림 모두 발송")
    void testHandle_WithEmail() {
        OrderPlacedEvent event = event("jane@example.com");

        listener.handleOrderPlaced(event);

        verify(notificationSender).sendCustomerConfirmation(event);
        verify(notificationSender).sendAdminNotification(event);
    }

    @Test
    @DisplayName("이메일이 없으면 관리자 알림만 발송")
    void testHandle_WithoutEmail() {
        OrderPlacedEvent event = event(null);

        listener.handleOrderPlaced(event);

        verify(notificationSender, never()).sendCustomerConfirmation(any());
        verify(notificationSender).sendAdminNotification(event);
    }

    @Test
    @DisplayName("고객 알림 실패 - 예외를 전파하지 않고 관리자 알림은 계속 시도")
    void testHandle_CustomerFailureIsSwallowed() {
        OrderPlacedEvent event = event("jane@example.com");
        doThrow(new ResourceAccessException("connection refused"))
                .when(notificationSender).sendCustomerConfirmation(event);

        assertDoesNotThrow(() -> listener.handleOrderPlaced(event));
        verify(notificationSender).sendAdminNotification(event);
    }

    @Test
    @DisplayName("관리자 알림 실패 - 예외를 전파하지 않는다")
    void testHandle_AdminFailureIsSwallowed() {
        OrderPlacedEvent event = event(null);
        doThrow(new ResourceAccessException("read timed out"))
                .when(notificationSender).sendAdminNotification(event);

        assertDoesNotThrow(() -> listener.handleOrderPlaced(event));
    }
}
