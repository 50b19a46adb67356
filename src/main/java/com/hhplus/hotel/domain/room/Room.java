package com.hhplus.hotel.domain.room;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Room 도메인 엔티티
 *
 * 책임:
 * - 객실 정보 (번호, 유형, 1박 요금, 최대 인원, 편의시설, 이미지) 관리
 * - 판매 노출 여부 (isAvailable) 관리
 *
 * 핵심 비즈니스 규칙:
 * - 객실 번호는 유일함
 * - 1박 요금은 0보다 커야 함
 * - isAvailable은 목록 노출용 플래그이며 예약이 생겨도 변경하지 않는다
 *   (기간별 예약 가능 여부는 RoomBooking으로 판단)
 */
@Entity
@Table(name = "rooms")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Room {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long roomId;

    @Column(name = "room_number", nullable = false, unique = true, length = 10)
    private String roomNumber;

    @Column(name = "room_type", nullable = false, length = 50)
    private String roomType;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "price_per_night", nullable = false, precision = 10, scale = 2)
    private BigDecimal pricePerNight;

    @Column(name = "max_occupancy", nullable = false)
    private Integer maxOccupancy;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "amenities")
    @Builder.Default
    private List<String> amenities = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "images")
    @Builder.Default
    private List<String> images = new ArrayList<>();

    @Column(name = "is_available", nullable = false)
    private Boolean isAvailable;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 객실 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 객실 번호, 유형, 제목은 필수
     * - 1박 요금은 0보다 커야 함
     * - 최대 인원 미지정 시 2명
     * - 생성 직후 판매 가능 상태
     */
    public static Room createRoom(String roomNumber, String roomType, String title, String description,
                                  BigDecimal pricePerNight, Integer maxOccupancy,
                                  List<String> amenities, List<String> images) {
        if (roomNumber == null || roomNumber.isBlank()) {
            throw new IllegalArgumentException("객실 번호는 필수입니다");
        }
        if (roomType == null || roomType.isBlank()) {
            throw new IllegalArgumentException("객실 유형은 필수입니다");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("객실 제목은 필수입니다");
        }
        if (pricePerNight == null || pricePerNight.signum() <= 0) {
            throw new IllegalArgumentException("1박 요금은 0보다 커야 합니다");
        }
        if (maxOccupancy != null && maxOccupancy <= 0) {
            throw new IllegalArgumentException("최대 인원은 1명 이상이어야 합니다");
        }

        LocalDateTime now = LocalDateTime.now();
        return Room.builder()
                .roomNumber(roomNumber)
                .roomType(roomType)
                .title(title)
                .description(description)
                .pricePerNight(pricePerNight.setScale(2, RoundingMode.HALF_UP))
                .maxOccupancy(maxOccupancy != null ? maxOccupancy : 2)
                .amenities(amenities != null ? new ArrayList<>(amenities) : new ArrayList<>())
                .images(images != null ? new ArrayList<>(images) : new ArrayList<>())
                .isAvailable(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 장바구니에 담을 수 있는 객실인지 확인
     */
    public boolean isBookable() {
        return Boolean.TRUE.equals(this.isAvailable);
    }
}
