package com.hhplus.hotel.infrastructure.persistence.room;

import com.hhplus.hotel.domain.room.Room;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Room JPA Repository
 * Spring Data JPA를 통한 Room 엔티티 영구 저장소
 */
public interface RoomJpaRepository extends JpaRepository<Room, Long> {

    List<Room> findByIsAvailableTrueOrderByRoomNumberAsc();

    boolean existsByRoomNumber(String roomNumber);
}
