package com.hhplus.hotel.presentation.admin.mapper;

import com.hhplus.hotel.application.admin.dto.AddProductCommand;
import com.hhplus.hotel.application.admin.dto.AddRoomCommand;
import com.hhplus.hotel.application.admin.dto.OrderPage;
import com.hhplus.hotel.application.admin.dto.OrderStatusChange;
import com.hhplus.hotel.domain.product.Product;
import com.hhplus.hotel.domain.room.Room;
import com.hhplus.hotel.presentation.admin.request.AddProductRequest;
import com.hhplus.hotel.presentation.admin.request.AddRoomRequest;
import com.hhplus.hotel.presentation.admin.response.AdminOrderListResponse;
import com.hhplus.hotel.presentation.admin.response.CreatedProductResponse;
import com.hhplus.hotel.presentation.admin.response.CreatedRoomResponse;
import com.hhplus.hotel.presentation.admin.response.UpdateOrderStatusResponse;
import com.hhplus.hotel.presentation.order.response.OrderResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AdminMapper - 관리자 API DTO 변환
 */
@Component
public class AdminMapper {

    public AddRoomCommand toAddRoomCommand(AddRoomRequest request) {
        return AddRoomCommand.builder()
                .roomNumber(request.getRoomNumber())
                .roomType(request.getRoomType())
                .title(request.getTitle())
                .description(request.getDescription())
                .pricePerNight(request.getPricePerNight())
                .maxOccupancy(request.getMaxOccupancy())
                .amenities(request.getAmenities())
                .images(request.getImages())
                .build();
    }

    public AddProductCommand toAddProductCommand(AddProductRequest request) {
        return AddProductCommand.builder()
                .name(request.getName())
                .description(request.getDescription())
                .price(request.getPrice())
                .category(request.getCategory())
                .stockQuantity(request.getStockQuantity())
                .images(request.getImages())
                .build();
    }

    public AdminOrderListResponse toOrderListResponse(OrderPage page) {
        List<OrderResponse> orders = page.getOrders().stream()
                .map(OrderResponse::summary)
                .collect(Collectors.toList());
        return AdminOrderListResponse.builder()
                .orders(orders)
                .count(orders.size())
                .totalCount(page.getTotalCount())
                .status(page.getStatus() != null ? page.getStatus().getCode() : "")
                .build();
    }

    public UpdateOrderStatusResponse toUpdateOrderStatusResponse(OrderStatusChange change) {
        return new UpdateOrderStatusResponse(
                "Order status updated successfully",
                change.getOrderId(),
                change.getStatus().getCode());
    }

    public CreatedRoomResponse toCreatedRoomResponse(Room room) {
        return new CreatedRoomResponse("Room created successfully", room.getRoomId(), room.getCreatedAt());
    }

    public CreatedProductResponse toCreatedProductResponse(Product product) {
        return new CreatedProductResponse("Product created successfully", product.getProductId(), product.getCreatedAt());
    }
}
