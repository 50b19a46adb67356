package com.hhplus.hotel.presentation.order.mapper;

import com.hhplus.hotel.application.order.dto.PlaceOrderCommand;
import com.hhplus.hotel.presentation.order.request.CreateOrderRequest;
import org.springframework.stereotype.Component;

/**
 * OrderMapper - 주문 요청 DTO → Application 커맨드 변환
 */
@Component
public class OrderMapper {

    public PlaceOrderCommand toPlaceOrderCommand(CreateOrderRequest request) {
        return PlaceOrderCommand.builder()
                .customerName(request.getCustomerName())
                .customerPhone(request.getCustomerPhone())
                .customerEmail(request.getCustomerEmail())
                .notes(request.getNotes())
                .build();
    }
}
