package com.hhplus.hotel.application.order;

import com.hhplus.hotel.domain.order.OrderConstants;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;

/**
 * 주문 번호 생성기
 *
 * 형식: ORD-{yyyyMMdd}-{사용자 ID}-{임의 토큰 8자리}
 * 예: ORD-20250601-42-3F9A1C0B
 *
 * 같은 사용자가 같은 초에 주문해도 토큰으로 구분된다.
 * 최종 유일성은 orders.order_number UNIQUE 제약이 보장한다.
 */
@Component
public class OrderNumberGenerator {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Clock clock;

    public OrderNumberGenerator() {
        this(Clock.systemDefaultZone());
    }

    OrderNumberGenerator(Clock clock) {
        this.clock = clock;
    }

    public String generate(Long customerId) {
        String token = UUID.randomUUID().toString()
                .replace("-", "")
                .substring(0, OrderConstants.ORDER_NUMBER_TOKEN_LENGTH)
                .toUpperCase(Locale.ROOT);
        return String.join("-",
                OrderConstants.ORDER_NUMBER_PREFIX,
                LocalDate.now(clock).format(DATE_FORMAT),
                String.valueOf(customerId),
                token);
    }
}
