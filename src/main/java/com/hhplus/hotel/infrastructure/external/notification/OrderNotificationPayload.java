package com.hhplus.hotel.infrastructure.external.notification;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.hotel.domain.order.event.OrderPlacedEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 알림 서비스 요청 본문
 *
 * 고객 확인/관리자 알림 두 엔드포인트가 같은 본문을 받는다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderNotificationPayload {

    @JsonProperty("order_number")
    private String orderNumber;

    @JsonProperty("customer_name")
    private String customerName;

    @JsonProperty("customer_phone")
    private String customerPhone;

    @JsonProperty("customer_email")
    private String customerEmail;

    @JsonProperty("total_amount")
    private BigDecimal totalAmount;

    @JsonProperty("status")
    private String status;

    @JsonProperty("items")
    private List<Item> items;

    public static OrderNotificationPayload from(OrderPlacedEvent event) {
        return OrderNotificationPayload.builder()
                .orderNumber(event.getOrderNumber())
                .customerName(event.getCustomerName())
                .customerPhone(event.getCustomerPhone())
                .customerEmail(event.getCustomerEmail() != null ? event.getCustomerEmail() : "")
                .totalAmount(event.getTotalAmount())
                .status(event.getStatus())
                .items(event.getItems().stream().map(Item::from).collect(Collectors.toList()))
                .build();
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {
        @JsonProperty("item_type")
        private String itemType;

        @JsonProperty("item_id")
        private Long itemId;

        @JsonProperty("item_name")
        private String itemName;

        @JsonProperty("quantity")
        private Integer quantity;

        @JsonProperty("unit_price")
        private BigDecimal unitPrice;

        @JsonProperty("total_price")
        private BigDecimal totalPrice;

        @JsonProperty("check_in_date")
        private LocalDate checkInDate;

        @JsonProperty("check_out_date")
        private LocalDate checkOutDate;

        @JsonProperty("nights")
        private Integer nights;

        static Item from(OrderPlacedEvent.Item item) {
            return Item.builder()
                    .itemType(item.getItemType())
                    .itemId(item.getItemId())
                    .itemName(item.getItemName())
                    .quantity(item.getQuantity())
                    .unitPrice(item.getUnitPrice())
                    .totalPrice(item.getTotalPrice())
                    .checkInDate(item.getCheckInDate())
                    .checkOutDate(item.getCheckOutDate())
                    .nights(item.getNights())
                    .build();
        }
    }
}
