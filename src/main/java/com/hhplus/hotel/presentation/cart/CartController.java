package com.hhplus.hotel.presentation.cart;

import com.hhplus.hotel.application.cart.CartService;
import com.hhplus.hotel.application.cart.dto.AddCartItemResult;
import com.hhplus.hotel.common.auth.CustomerPrincipal;
import com.hhplus.hotel.presentation.cart.mapper.CartMapper;
import com.hhplus.hotel.presentation.cart.request.AddCartItemRequest;
import com.hhplus.hotel.presentation.cart.response.AddCartItemResponse;
import com.hhplus.hotel.presentation.cart.response.CartResponse;
import com.hhplus.hotel.presentation.common.auth.CurrentCustomer;
import com.hhplus.hotel.presentation.common.response.MessageResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * CartController - Presentation 계층
 * 장바구니 API 요청 처리
 */
@RestController
@RequestMapping("/cart")
public class CartController {

    private final CartService cartService;
    private final CartMapper cartMapper;

    public CartController(CartService cartService, CartMapper cartMapper) {
        this.cartService = cartService;
        this.cartMapper = cartMapper;
    }

    /**
     * GET /cart - 장바구니 조회
     */
    @GetMapping
    public ResponseEntity<CartResponse> getCart(@CurrentCustomer CustomerPrincipal customer) {
        return ResponseEntity.ok(cartMapper.toCartResponse(cartService.getCart(customer)));
    }

    /**
     * POST /cart/add - 장바구니 항목 추가
     * 새 라인이면 201, 기존 라인 수량 증가면 200
     */
    @PostMapping("/add")
    public ResponseEntity<AddCartItemResponse> addCartItem(
            @CurrentCustomer CustomerPrincipal customer,
            @Valid @RequestBody AddCartItemRequest request) {
        AddCartItemResult result = cartService.addItem(customer, cartMapper.toAddCartItemCommand(request));
        HttpStatus status = result.isCreated() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(cartMapper.toAddCartItemResponse(result));
    }

    /**
     * DELETE /cart/clear - 장바구니 비우기
     */
    @DeleteMapping("/clear")
    public ResponseEntity<MessageResponse> clearCart(@CurrentCustomer CustomerPrincipal customer) {
        cartService.clearCart(customer);
        return ResponseEntity.ok(new MessageResponse("Cart cleared successfully"));
    }

    /**
     * DELETE /cart/{id} - 장바구니 항목 삭제
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<MessageResponse> removeCartItem(
            @CurrentCustomer CustomerPrincipal customer,
            @PathVariable("id") Long cartItemId) {
        cartService.removeItem(customer, cartItemId);
        return ResponseEntity.ok(new MessageResponse("Item removed from cart"));
    }
}
