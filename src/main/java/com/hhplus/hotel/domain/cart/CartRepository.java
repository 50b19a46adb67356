package com.hhplus.hotel.domain.cart;

import com.hhplus.hotel.domain.common.ItemType;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * CartRepository - 장바구니 저장소 (Domain Layer - Port)
 */
public interface CartRepository {

    /**
     * 사용자의 장바구니 라인 (최신순)
     */
    List<CartItem> findByCustomerId(Long customerId);

    /**
     * 병합 대상 라인 조회
     * 날짜가 null이면 날짜가 없는 라인과만 일치한다.
     */
    Optional<CartItem> findLine(Long customerId, ItemType itemType, Long itemId,
                                LocalDate checkInDate, LocalDate checkOutDate);

    Optional<CartItem> findById(Long cartItemId);

    CartItem save(CartItem cartItem);

    void delete(CartItem cartItem);

    /**
     * 사용자의 모든 라인 삭제
     *
     * @return 삭제된 라인 수
     */
    int deleteByCustomerId(Long customerId);
}
