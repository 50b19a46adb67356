package com.hhplus.hotel.application.notification;

import com.hhplus.hotel.domain.order.event.OrderPlacedEvent;
import com.hhplus.hotel.infrastructure.config.async.AsyncConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * OrderNotificationListener - 주문 커밋 후 알림 발송
 *
 * - 주문 트랜잭션이 커밋된 뒤에만 실행된다 (롤백 시 알림 없음)
 * - notificationExecutor 스레드에서 실행되어 주문 응답을 지연시키지 않는다
 * - 고객 알림과 관리자 알림은 서로 독립적으로 시도된다
 * - 실패는 WARN으로 기록하고 버린다 (재시도 없음)
 */
@Slf4j
@Component
public class OrderNotificationListener {

    private final OrderNotificationSender notificationSender;

    public OrderNotificationListener(OrderNotificationSender notificationSender) {
        this.notificationSender = notificationSender;
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleOrderPlaced(OrderPlacedEvent event) {
        log.info("[OrderNotificationListener] 주문 알림 발송 시작 - orderId={}, orderNumber={}",
                event.getOrderId(), event.getOrderNumber());

        if (event.hasCustomerEmail()) {
            try {
                notificationSender.sendCustomerConfirmation(event);
            } catch (Exception e) {
                log.warn("[OrderNotificationListener] 고객 확인 알림 실패 (무시) - orderNumber={}, error={}",
                        event.getOrderNumber(), e.getMessage());
            }
        }

        try {
            notificationSender.sendAdminNotification(event);
        } catch (Exception e) {
            log.warn("[OrderNotificationListener] 관리자 알림 실패 (무시) - orderNumber={}, error={}",
                    event.getOrderNumber(), e.getMessage());
        }
    }
}
