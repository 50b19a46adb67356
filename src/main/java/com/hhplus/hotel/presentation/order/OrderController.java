package com.hhplus.hotel.presentation.order;

import com.hhplus.hotel.application.order.OrderService;
import com.hhplus.hotel.common.auth.CustomerPrincipal;
import com.hhplus.hotel.presentation.common.auth.CurrentCustomer;
import com.hhplus.hotel.presentation.order.mapper.OrderMapper;
import com.hhplus.hotel.presentation.order.request.CreateOrderRequest;
import com.hhplus.hotel.presentation.order.response.CreateOrderResponse;
import com.hhplus.hotel.presentation.order.response.OrderListResponse;
import com.hhplus.hotel.presentation.order.response.OrderResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * OrderController - Presentation 계층
 * 체크아웃 및 본인 주문 조회 API
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderService orderService;
    private final OrderMapper orderMapper;

    public OrderController(OrderService orderService, OrderMapper orderMapper) {
        this.orderService = orderService;
        this.orderMapper = orderMapper;
    }

    /**
     * POST /orders - 장바구니로 주문 생성
     */
    @PostMapping
    public ResponseEntity<CreateOrderResponse> createOrder(
            @CurrentCustomer CustomerPrincipal customer,
            @Valid @RequestBody CreateOrderRequest request) {
        CreateOrderResponse response = CreateOrderResponse.from(
                orderService.placeOrder(customer, orderMapper.toPlaceOrderCommand(request)));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * GET /orders - 본인 주문 목록
     */
    @GetMapping
    public ResponseEntity<OrderListResponse> getOrders(@CurrentCustomer CustomerPrincipal customer) {
        return ResponseEntity.ok(OrderListResponse.from(orderService.getOrders(customer)));
    }

    /**
     * GET /orders/{id} - 본인 주문 상세
     */
    @GetMapping("/{id}")
    public ResponseEntity<OrderResponse> getOrder(
            @CurrentCustomer CustomerPrincipal customer,
            @PathVariable("id") Long orderId) {
        return ResponseEntity.ok(OrderResponse.withItems(orderService.getOrder(customer, orderId)));
    }
}
