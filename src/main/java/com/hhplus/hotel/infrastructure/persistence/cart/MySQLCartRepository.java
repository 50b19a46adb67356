package com.hhplus.hotel.infrastructure.persistence.cart;

import com.hhplus.hotel.domain.cart.CartItem;
import com.hhplus.hotel.domain.cart.CartRepository;
import com.hhplus.hotel.domain.common.ItemType;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Cart Repository 구현
 */
@Repository
public class MySQLCartRepository implements CartRepository {

    private final CartItemJpaRepository cartItemJpaRepository;

    public MySQLCartRepository(CartItemJpaRepository cartItemJpaRepository) {
        this.cartItemJpaRepository = cartItemJpaRepository;
    }

    @Override
    public List<CartItem> findByCustomerId(Long customerId) {
        return cartItemJpaRepository.findByCustomerIdOrderByCreatedAtDescCartItemIdDesc(customerId);
    }

    @Override
    public Optional<CartItem> findLine(Long customerId, ItemType itemType, Long itemId,
                                       LocalDate checkInDate, LocalDate checkOutDate) {
        return cartItemJpaRepository.findByCustomerIdAndItemTypeAndItemIdAndCheckInDateAndCheckOutDate(
                customerId, itemType, itemId, checkInDate, checkOutDate);
    }

    @Override
    public Optional<CartItem> findById(Long cartItemId) {
        return cartItemJpaRepository.findById(cartItemId);
    }

    @Override
    public CartItem save(CartItem cartItem) {
        return cartItemJpaRepository.save(cartItem);
    }

    @Override
    public void delete(CartItem cartItem) {
        cartItemJpaRepository.delete(cartItem);
    }

    @Override
    public int deleteByCustomerId(Long customerId) {
        return cartItemJpaRepository.deleteAllByCustomerId(customerId);
    }
}
