package com.hhplus.hotel.infrastructure.external.notification;

import com.hhplus.hotel.application.notification.OrderNotificationSender;
import com.hhplus.hotel.domain.order.event.OrderPlacedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * HttpOrderNotificationClient - 외부 알림 서비스 HTTP 클라이언트
 *
 * POST {baseUrl}/send-order-confirmation (고객)
 * POST {baseUrl}/send-admin-notification (관리자)
 *
 * 요청당 한 번만 시도하며, RestClientException은 그대로 호출자에게 전달된다.
 */
@Slf4j
@Component
public class HttpOrderNotificationClient implements OrderNotificationSender {

    static final String CUSTOMER_CONFIRMATION_PATH = "/send-order-confirmation";
    static final String ADMIN_NOTIFICATION_PATH = "/send-admin-notification";

    private final RestTemplate restTemplate;
    private final NotificationProperties properties;

    public HttpOrderNotificationClient(@Qualifier("notificationRestTemplate") RestTemplate restTemplate,
                                       NotificationProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public void sendCustomerConfirmation(OrderPlacedEvent event) {
        post(CUSTOMER_CONFIRMATION_PATH, event);
    }

    @Override
    public void sendAdminNotification(OrderPlacedEvent event) {
        post(ADMIN_NOTIFICATION_PATH, event);
    }

    private void post(String path, OrderPlacedEvent event) {
        if (!properties.isEnabled()) {
            log.info("[HttpOrderNotificationClient] 알림 비활성화 - 전송 생략: path={}, orderNumber={}",
                    path, event.getOrderNumber());
            return;
        }
        restTemplate.postForEntity(path, OrderNotificationPayload.from(event), Void.class);
        log.info("[HttpOrderNotificationClient] 알림 전송 완료 - path={}, orderNumber={}", path, event.getOrderNumber());
    }
}
