package com.hhplus.hotel.domain.room;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Room Repository Interface (Domain Layer - Port)
 * 객실 데이터 접근 인터페이스
 */
public interface RoomRepository {

    /**
     * 판매 가능한 객실 목록 (객실 번호 순)
     */
    List<Room> findAvailableOrderByRoomNumber();

    /**
     * ID로 객실 조회 (판매 가능 여부 무관)
     */
    Optional<Room> findById(Long roomId);

    /**
     * 여러 객실 일괄 조회
     */
    List<Room> findAllByIds(Collection<Long> roomIds);

    boolean existsByRoomNumber(String roomNumber);

    Room save(Room room);
}
