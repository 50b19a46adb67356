package com.hhplus.hotel.infrastructure.external.notification;

import com.hhplus.hotel.domain.order.event.OrderPlacedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.DefaultUriBuilderFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * HttpOrderNotificationClientTest - 알림 서비스 요청 형식 검증 (MockRestServiceServer)
 */
@DisplayName("HttpOrderNotificationClient 테스트")
class HttpOrderNotificationClientTest {

    private static final String BASE_URL = "http://notification.local";

    private MockRestServiceServer server;
    private NotificationProperties properties;
    private HttpOrderNotificationClient client;

    @BeforeEach
    void setup() {
        RestTemplate restTemplate = new RestTemplate();
        restTemplate.setUriTemplateHandler(new DefaultUriBuilderFactory(BASE_URL));
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new NotificationProperties();
        properties.setBaseUrl(BASE_URL);
        client = new HttpOrderNotificationClient(restTemplate, properties);
    }

    private OrderPlacedEvent event() {
        OrderPlacedEvent.Item room = new OrderPlacedEvent.Item("room", 2L, "Deluxe Double Room", 1,
                new BigDecimal("149.99"), new BigDecimal("449.97"),
                LocalDate.of(2025, 6, 1), LocalDate.of(2025, 6, 4), 3);
        return new OrderPlacedEvent(10L, "ORD-20250601-1-ABCDEF12", "Jane Doe", "010-1234-5678", null,
                new BigDecimal("449.97"), "confirmed", List.of(room));
    }

    @Test
    @DisplayName("관리자 알림 - snake_case 본문으로 POST")
    void testSendAdminNotification() {
        server.expect(requestTo(BASE_URL + "/send-admin-notification"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.order_number").value("ORD-20250601-1-ABCDEF12"))
                .andExpect(jsonPath("$.customer_email").value(""))
                .andExpect(jsonPath("$.status").value("confirmed"))
                .andExpect(jsonPath("$.items[0].item_type").value("room"))
                .andRespond(withSuccess());

        client.sendAdminNotification(event());

        server.verify();
    }

    @Test
    @DisplayName("고객 알림 - 서버 오류는 호출자에게 전달")
    void testSendCustomerConfirmation_ServerError() {
        server.expect(requestTo(BASE_URL + "/send-order-confirmation"))
                .andRespond(withServerError());

        assertThrows(HttpServerErrorException.class, () -> client.sendCustomerConfirmation(event()));
    }

    @Test
    @DisplayName("비활성화 상태 - 요청을 보내지 않는다")
    void testDisabled() {
        properties.setEnabled(false);

        client.sendAdminNotification(event());

        server.verify();
    }
}
