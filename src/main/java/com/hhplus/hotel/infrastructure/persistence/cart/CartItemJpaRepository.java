package com.hhplus.hotel.infrastructure.persistence.cart;

import com.hhplus.hotel.domain.cart.CartItem;
import com.hhplus.hotel.domain.common.ItemType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * CartItem JPA Repository
 */
public interface CartItemJpaRepository extends JpaRepository<CartItem, Long> {

    List<CartItem> findByCustomerIdOrderByCreatedAtDescCartItemIdDesc(Long customerId);

    /**
     * 병합 대상 라인 조회
     * 파생 쿼리는 null 인자를 IS NULL 조건으로 변환한다.
     */
    Optional<CartItem> findByCustomerIdAndItemTypeAndItemIdAndCheckInDateAndCheckOutDate(
            Long customerId, ItemType itemType, Long itemId, LocalDate checkInDate, LocalDate checkOutDate);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM CartItem c WHERE c.customerId = :customerId")
    int deleteAllByCustomerId(@Param("customerId") Long customerId);
}
