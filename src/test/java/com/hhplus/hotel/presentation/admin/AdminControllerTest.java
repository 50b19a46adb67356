package com.hhplus.hotel.presentation.admin;

import com.hhplus.hotel.application.admin.CatalogAdminService;
import com.hhplus.hotel.application.admin.OrderAdminService;
import com.hhplus.hotel.application.admin.dto.AddRoomCommand;
import com.hhplus.hotel.application.admin.dto.OrderPage;
import com.hhplus.hotel.application.admin.dto.OrderStatusChange;
import com.hhplus.hotel.common.exception.DomainException;
import com.hhplus.hotel.common.exception.ErrorCode;
import com.hhplus.hotel.domain.order.InvalidOrderStatusException;
import com.hhplus.hotel.domain.order.OrderFixtures;
import com.hhplus.hotel.domain.order.OrderStatus;
import com.hhplus.hotel.domain.room.DuplicateRoomNumberException;
import com.hhplus.hotel.domain.room.Room;
import com.hhplus.hotel.presentation.ControllerTestSupport;
import com.hhplus.hotel.presentation.admin.mapper.AdminMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * AdminControllerTest - 관리자 API 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AdminController 단위 테스트")
class AdminControllerTest extends ControllerTestSupport {

    private MockMvc mockMvc;

    @Mock
    private OrderAdminService orderAdminService;

    @Mock
    private CatalogAdminService catalogAdminService;

    @BeforeEach
    void setup() {
        mockMvc = buildMockMvc(new AdminController(orderAdminService, catalogAdminService, new AdminMapper()));
    }

    // ========== 주문 목록 ==========

    @Test
    @DisplayName("주문 목록 - 기본 limit 50, 항목 없이 요약")
    void testGetOrders_Defaults() throws Exception {
        when(orderAdminService.getOrders(null, 50, 0))
                .thenReturn(new OrderPage(List.of(OrderFixtures.placedOrder(1L)), 3L, null));

        mockMvc.perform(get("/admin/orders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.total_count").value(3))
                .andExpect(jsonPath("$.status").value(""))
                .andExpect(jsonPath("$.orders[0].items").doesNotExist());
    }

    @Test
    @DisplayName("주문 목록 - 상태 필터")
    void testGetOrders_WithStatus() throws Exception {
        when(orderAdminService.getOrders("confirmed", 10, 20))
                .thenReturn(new OrderPage(List.of(), 0L, OrderStatus.CONFIRMED));

        mockMvc.perform(get("/admin/orders").param("status", "confirmed").param("limit", "10").param("offset", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("confirmed"));
    }

    @Test
    @DisplayName("주문 목록 실패 - 잘못된 상태")
    void testGetOrders_InvalidStatus() throws Exception {
        when(orderAdminService.getOrders(eq("shipped"), anyInt(), anyInt()))
                .thenThrow(new DomainException(ErrorCode.INVALID_ORDER_STATUS));

        mockMvc.perform(get("/admin/orders").param("status", "shipped"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_ORDER_STATUS"));
    }

    // ========== 상태 변경 ==========

    @Test
    @DisplayName("상태 변경 - 성공")
    void testUpdateOrderStatus() throws Exception {
        when(orderAdminService.updateStatus(7L, "cancelled", "guest request"))
                .thenReturn(new OrderStatusChange(7L, OrderStatus.CANCELLED, 1));

        mockMvc.perform(put("/admin/orders/7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"cancelled\",\"notes\":\"guest request\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Order status updated successfully"))
                .andExpect(jsonPath("$.order_id").value(7))
                .andExpect(jsonPath("$.status").value("cancelled"));
    }

    @Test
    @DisplayName("상태 변경 실패 - 취소된 주문")
    void testUpdateOrderStatus_Terminal() throws Exception {
        when(orderAdminService.updateStatus(7L, "pending", null))
                .thenThrow(new InvalidOrderStatusException(7L, OrderStatus.CANCELLED, OrderStatus.PENDING));

        mockMvc.perform(put("/admin/orders/7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"pending\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_ORDER_TRANSITION"));
    }

    @Test
    @DisplayName("상태 변경 실패 - status 누락")
    void testUpdateOrderStatus_MissingStatus() throws Exception {
        mockMvc.perform(put("/admin/orders/7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"notes\":\"x\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(orderAdminService);
    }

    // ========== 객실/상품 등록 ==========

    @Test
    @DisplayName("객실 등록 - 201")
    void testAddRoom() throws Exception {
        Room saved = Room.builder().roomId(9L).roomNumber("401")
                .createdAt(LocalDateTime.of(2025, 6, 1, 9, 30)).build();
        when(catalogAdminService.addRoom(any(AddRoomCommand.class))).thenReturn(saved);

        mockMvc.perform(post("/admin/rooms")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"room_number\":\"401\",\"room_type\":\"double\",\"title\":\"Garden Room\","
                                + "\"price_per_night\":120.00,\"amenities\":[\"wifi\"]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.room_id").value(9))
                .andExpect(jsonPath("$.created_at").value("2025-06-01T09:30:00"));
    }

    @Test
    @DisplayName("객실 등록 실패 - 중복 객실 번호")
    void testAddRoom_Duplicate() throws Exception {
        when(catalogAdminService.addRoom(any(AddRoomCommand.class)))
                .thenThrow(new DuplicateRoomNumberException("101"));

        mockMvc.perform(post("/admin/rooms")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"room_number\":\"101\",\"room_type\":\"single\",\"title\":\"Cozy\","
                                + "\"price_per_night\":89.99}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DUPLICATE_ROOM_NUMBER"));
    }

    @Test
    @DisplayName("상품 등록 실패 - 가격 누락")
    void testAddProduct_MissingPrice() throws Exception {
        mockMvc.perform(post("/admin/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Mug\",\"category\":\"souvenirs\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_REQUEST"));

        verifyNoInteractions(catalogAdminService);
    }
}
