package com.hhplus.hotel.presentation.admin;

import com.hhplus.hotel.application.admin.CatalogAdminService;
import com.hhplus.hotel.application.admin.OrderAdminService;
import com.hhplus.hotel.presentation.admin.mapper.AdminMapper;
import com.hhplus.hotel.presentation.admin.request.AddProductRequest;
import com.hhplus.hotel.presentation.admin.request.AddRoomRequest;
import com.hhplus.hotel.presentation.admin.request.UpdateOrderStatusRequest;
import com.hhplus.hotel.presentation.admin.response.AdminOrderListResponse;
import com.hhplus.hotel.presentation.admin.response.CreatedProductResponse;
import com.hhplus.hotel.presentation.admin.response.CreatedRoomResponse;
import com.hhplus.hotel.presentation.admin.response.UpdateOrderStatusResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * AdminController - Presentation 계층
 *
 * 관리자 API: 주문 목록 조회, 주문 상태 변경(취소 시 객실 예약 연쇄 취소), 객실/상품 등록
 * 인증은 범위 밖이며 별도 게이트웨이에서 보호한다고 가정한다.
 */
@RestController
@RequestMapping("/admin")
public class AdminController {

    private final OrderAdminService orderAdminService;
    private final CatalogAdminService catalogAdminService;
    private final AdminMapper adminMapper;

    public AdminController(OrderAdminService orderAdminService,
                           CatalogAdminService catalogAdminService,
                           AdminMapper adminMapper) {
        this.orderAdminService = orderAdminService;
        this.catalogAdminService = catalogAdminService;
        this.adminMapper = adminMapper;
    }

    /**
     * GET /admin/orders?status=&limit=&offset=
     * limit=0이면 전체 조회
     */
    @GetMapping("/orders")
    public ResponseEntity<AdminOrderListResponse> getOrders(
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "limit", defaultValue = "50") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset) {
        return ResponseEntity.ok(adminMapper.toOrderListResponse(
                orderAdminService.getOrders(status, limit, offset)));
    }

    /**
     * PUT /admin/orders/{id} - 주문 상태 변경
     */
    @PutMapping("/orders/{id}")
    public ResponseEntity<UpdateOrderStatusResponse> updateOrderStatus(
            @PathVariable("id") Long orderId,
            @Valid @RequestBody UpdateOrderStatusRequest request) {
        return ResponseEntity.ok(adminMapper.toUpdateOrderStatusResponse(
                orderAdminService.updateStatus(orderId, request.getStatus(), request.getNotes())));
    }

    @PostMapping("/rooms")
    public ResponseEntity<CreatedRoomResponse> addRoom(@Valid @RequestBody AddRoomRequest request) {
        CreatedRoomResponse response = adminMapper.toCreatedRoomResponse(
                catalogAdminService.addRoom(adminMapper.toAddRoomCommand(request)));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/products")
    public ResponseEntity<CreatedProductResponse> addProduct(@Valid @RequestBody AddProductRequest request) {
        CreatedProductResponse response = adminMapper.toCreatedProductResponse(
                catalogAdminService.addProduct(adminMapper.toAddProductCommand(request)));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
