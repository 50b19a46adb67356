package com.hhplus.hotel.presentation.cart;

import com.hhplus.hotel.application.cart.CartService;
import com.hhplus.hotel.application.cart.dto.AddCartItemCommand;
import com.hhplus.hotel.application.cart.dto.AddCartItemResult;
import com.hhplus.hotel.application.cart.dto.CartView;
import com.hhplus.hotel.common.auth.CustomerPrincipal;
import com.hhplus.hotel.domain.cart.CartItemNotFoundException;
import com.hhplus.hotel.domain.cart.InvalidQuantityException;
import com.hhplus.hotel.domain.order.OrderFixtures;
import com.hhplus.hotel.presentation.ControllerTestSupport;
import com.hhplus.hotel.presentation.cart.mapper.CartMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * CartControllerTest - Presentation Layer Unit Test
 *
 * 테스트 대상: CartController
 * - GET /cart
 * - POST /cart/add (신규 201 / 합산 200)
 * - DELETE /cart/{id}, DELETE /cart/clear
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CartController 단위 테스트")
class CartControllerTest extends ControllerTestSupport {

    private static final Long TEST_USER_ID = 1L;

    private MockMvc mockMvc;

    @Mock
    private CartService cartService;

    @BeforeEach
    void setup() {
        mockMvc = buildMockMvc(new CartController(cartService, new CartMapper()));
    }

    @Test
    @DisplayName("장바구니 조회 - 성공")
    void testGetCart_Success() throws Exception {
        CartView view = new CartView(TEST_USER_ID,
                List.of(OrderFixtures.roomLine(10L), OrderFixtures.productLine(11L)), new BigDecimal("499.95"));
        when(cartService.getCart(any(CustomerPrincipal.class))).thenReturn(view);

        mockMvc.perform(get("/cart").header(USER_ID_HEADER, TEST_USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user_id").value(TEST_USER_ID))
                .andExpect(jsonPath("$.item_count").value(2))
                .andExpect(jsonPath("$.total_amount").value(499.95))
                .andExpect(jsonPath("$.cart_items[0].item_type").value("room"))
                .andExpect(jsonPath("$.cart_items[0].nights").value(3))
                .andExpect(jsonPath("$.cart_items[0].check_in_date").value("2025-06-01"))
                .andExpect(jsonPath("$.cart_items[1].total_price").value(49.98));
    }

    @Test
    @DisplayName("장바구니 조회 실패 - X-USER-ID 헤더 누락")
    void testGetCart_MissingHeader() throws Exception {
        mockMvc.perform(get("/cart"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_CUSTOMER_ID"));

        verifyNoInteractions(cartService);
    }

    @Test
    @DisplayName("장바구니 조회 실패 - 숫자가 아닌 X-USER-ID")
    void testGetCart_InvalidHeader() throws Exception {
        mockMvc.perform(get("/cart").header(USER_ID_HEADER, "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_CUSTOMER_ID"));
    }

    @Test
    @DisplayName("항목 추가 - 새 라인이면 201")
    void testAddCartItem_Created() throws Exception {
        when(cartService.addItem(any(CustomerPrincipal.class), any(AddCartItemCommand.class)))
                .thenReturn(new AddCartItemResult(21L, true));

        mockMvc.perform(post("/cart/add")
                        .header(USER_ID_HEADER, TEST_USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"item_type\":\"room\",\"item_id\":2,\"quantity\":1,"
                                + "\"check_in_date\":\"2025-06-01\",\"check_out_date\":\"2025-06-04\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.cart_item_id").value(21))
                .andExpect(jsonPath("$.message").value("Item added to cart"));

        ArgumentCaptor<AddCartItemCommand> captor = ArgumentCaptor.forClass(AddCartItemCommand.class);
        verify(cartService).addItem(any(CustomerPrincipal.class), captor.capture());
        assertEquals(LocalDate.of(2025, 6, 4), captor.getValue().getCheckOutDate());
    }

    @Test
    @DisplayName("항목 추가 - 기존 라인 수량 합산이면 200")
    void testAddCartItem_Merged() throws Exception {
        when(cartService.addItem(any(CustomerPrincipal.class), any(AddCartItemCommand.class)))
                .thenReturn(new AddCartItemResult(21L, false));

        mockMvc.perform(post("/cart/add")
                        .header(USER_ID_HEADER, TEST_USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"item_type\":\"product\",\"item_id\":1,\"quantity\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cart_item_id").value(21));
    }

    @Test
    @DisplayName("항목 추가 실패 - 필수 필드 누락")
    void testAddCartItem_MissingFields() throws Exception {
        mockMvc.perform(post("/cart/add")
                        .header(USER_ID_HEADER, TEST_USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"item_type\":\"product\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_REQUEST"));

        verifyNoInteractions(cartService);
    }

    @Test
    @DisplayName("항목 추가 실패 - 잘못된 날짜 형식")
    void testAddCartItem_MalformedDate() throws Exception {
        mockMvc.perform(post("/cart/add")
                        .header(USER_ID_HEADER, TEST_USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"item_type\":\"room\",\"item_id\":2,\"quantity\":1,"
                                + "\"check_in_date\":\"06/01/2025\",\"check_out_date\":\"2025-06-04\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("항목 추가 실패 - 수량 범위 위반은 INVALID_QUANTITY")
    void testAddCartItem_InvalidQuantity() throws Exception {
        when(cartService.addItem(any(CustomerPrincipal.class), any(AddCartItemCommand.class)))
                .thenThrow(new InvalidQuantityException(1001));

        mockMvc.perform(post("/cart/add")
                        .header(USER_ID_HEADER, TEST_USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"item_type\":\"product\",\"item_id\":1,\"quantity\":1001}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_QUANTITY"));
    }

    @Test
    @DisplayName("항목 삭제 실패 - 없는 항목은 404")
    void testRemoveCartItem_NotFound() throws Exception {
        doThrow(new CartItemNotFoundException(99L))
                .when(cartService).removeItem(any(CustomerPrincipal.class), eq(99L));

        mockMvc.perform(delete("/cart/99").header(USER_ID_HEADER, TEST_USER_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("CART_ITEM_NOT_FOUND"));
    }

    @Test
    @DisplayName("장바구니 비우기 - 성공")
    void testClearCart() throws Exception {
        mockMvc.perform(delete("/cart/clear").header(USER_ID_HEADER, TEST_USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Cart cleared successfully"));

        verify(cartService).clearCart(any(CustomerPrincipal.class));
        verify(cartService, never()).removeItem(any(), any());
    }
}
