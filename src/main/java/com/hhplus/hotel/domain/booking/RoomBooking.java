package com.hhplus.hotel.domain.booking;

import com.hhplus.hotel.domain.common.vo.StayRange;
import com.hhplus.hotel.domain.order.OrderItem;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * RoomBooking 도메인 엔티티
 *
 * 책임:
 * - 주문의 객실 항목 1개에 대응하는 숙박 기간 점유 기록
 *
 * 핵심 비즈니스 규칙:
 * - 객실 + 숙박 기간이 있는 주문 항목마다 정확히 1건 생성
 * - 투숙 인원 = 주문 항목 수량
 * - 생성 시 상태는 CONFIRMED
 * - 취소는 멱등 (이미 취소된 예약은 변경하지 않음)
 */
@Entity
@Table(name = "room_bookings", indexes = {
    @Index(name = "idx_room_bookings_room_dates", columnList = "room_id, check_in_date, check_out_date"),
    @Index(name = "idx_room_bookings_order", columnList = "order_id")
})
@Getter
@Builder(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RoomBooking {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long bookingId;

    @Column(name = "room_id", nullable = false)
    private Long roomId;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "order_item_id", nullable = false)
    private Long orderItemId;

    @Column(name = "check_in_date", nullable = false)
    private LocalDate checkInDate;

    @Column(name = "check_out_date", nullable = false)
    private LocalDate checkOutDate;

    @Column(name = "guest_count", nullable = false)
    private Integer guestCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 저장된 주문 항목으로부터 예약 생성
     *
     * @throws IllegalArgumentException 객실 + 숙박 기간 항목이 아닌 경우
     */
    public static RoomBooking forOrderItem(OrderItem orderItem) {
        if (!orderItem.requiresBooking()) {
            throw new IllegalArgumentException("객실 숙박 항목만 예약을 생성할 수 있습니다");
        }
        StayRange stayRange = orderItem.getStayRange();
        LocalDateTime now = LocalDateTime.now();
        return RoomBooking.builder()
                .roomId(orderItem.getItemId())
                .orderId(orderItem.getOrder().getOrderId())
                .orderItemId(orderItem.getOrderItemId())
                .checkInDate(stayRange.getCheckIn())
                .checkOutDate(stayRange.getCheckOut())
                .guestCount(orderItem.getQuantity())
                .status(BookingStatus.CONFIRMED)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 예약 취소 (멱등)
     *
     * @return 상태가 실제로 변경되었는지 여부
     */
    public boolean cancel() {
        if (this.status == BookingStatus.CANCELLED) {
            return false;
        }
        this.status = BookingStatus.CANCELLED;
        this.updatedAt = LocalDateTime.now();
        return true;
    }

    public StayRange getStayRange() {
        return StayRange.of(checkInDate, checkOutDate);
    }
}
