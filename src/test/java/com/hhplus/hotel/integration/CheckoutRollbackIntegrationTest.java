package com.hhplus.hotel.integration;

import com.hhplus.hotel.application.cart.CartService;
import com.hhplus.hotel.application.cart.dto.AddCartItemCommand;
import com.hhplus.hotel.application.order.OrderService;
import com.hhplus.hotel.application.order.dto.PlaceOrderCommand;
import com.hhplus.hotel.common.auth.CustomerPrincipal;
import com.hhplus.hotel.common.exception.ErrorCode;
import com.hhplus.hotel.common.exception.SystemException;
import com.hhplus.hotel.domain.booking.RoomBookingRepository;
import com.hhplus.hotel.domain.cart.CartRepository;
import com.hhplus.hotel.domain.room.Room;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;

/**
 * 체크아웃 도중 예약 저장이 실패하면 주문과 장바구니 삭제가 모두 롤백되는지 검증
 */
@DisplayName("체크아웃 롤백 통합 테스트")
class CheckoutRollbackIntegrationTest extends BaseIntegrationTest {

    @MockitoSpyBean
    private RoomBookingRepository roomBookingRepository;

    @Autowired
    private CartService cartService;

    @Autowired
    private OrderService orderService;

    @Autowired
    private CartRepository cartRepository;

    @Test
    @DisplayName("예약 저장 실패 - 주문이 남지 않고 장바구니는 그대로")
    void testCheckout_RollsBackOnBookingFailure() {
        CustomerPrincipal customer = newCustomer();
        Room room = saveRoom("149.99");
        cartService.addItem(customer, AddCartItemCommand.builder()
                .itemType("room").itemId(room.getRoomId()).quantity(1)
                .checkInDate(LocalDate.of(2030, 7, 1)).checkOutDate(LocalDate.of(2030, 7, 3)).build());
        doThrow(new DataIntegrityViolationException("booking insert failed"))
                .when(roomBookingRepository).saveAll(anyList());

        assertThatThrownBy(() -> orderService.placeOrder(customer, PlaceOrderCommand.builder()
                .customerName("Jane Doe").customerPhone("010-1234-5678").build()))
                .isInstanceOf(SystemException.class)
                .extracting(e -> ((SystemException) e).getErrorCode())
                .isEqualTo(ErrorCode.ORDER_CREATION_FAILED);

        assertThat(orderService.getOrders(customer)).isEmpty();
        assertThat(cartRepository.findByCustomerId(customer.getCustomerId())).hasSize(1);
    }
}
