package com.hhplus.hotel.application.notification;

import com.hhplus.hotel.domain.order.event.OrderPlacedEvent;

/**
 * 주문 알림 발송 Port
 *
 * 구현체는 한 번만 시도하며 재시도하지 않는다.
 * 실패는 예외로 알리고, 호출자가 기록 후 버린다.
 */
public interface OrderNotificationSender {

    /**
     * 고객 확인 알림 (이메일이 있는 주문만 호출된다)
     */
    void sendCustomerConfirmation(OrderPlacedEvent event);

    /**
     * 관리자 신규 주문 알림
     */
    void sendAdminNotification(OrderPlacedEvent event);
}
