package com.hhplus.hotel.infrastructure.persistence.room;

import com.hhplus.hotel.domain.room.Room;
import com.hhplus.hotel.domain.room.RoomRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Room Repository 구현
 * Port(RoomRepository) 인터페이스를 JpaRepository로 구현
 */
@Repository
public class MySQLRoomRepository implements RoomRepository {

    private final RoomJpaRepository roomJpaRepository;

    public MySQLRoomRepository(RoomJpaRepository roomJpaRepository) {
        this.roomJpaRepository = roomJpaRepository;
    }

    @Override
    public List<Room> findAvailableOrderByRoomNumber() {
        return roomJpaRepository.findByIsAvailableTrueOrderByRoomNumberAsc();
    }

    @Override
    public Optional<Room> findById(Long roomId) {
        return roomJpaRepository.findById(roomId);
    }

    @Override
    public List<Room> findAllByIds(Collection<Long> roomIds) {
        if (roomIds.isEmpty()) {
            return List.of();
        }
        return roomJpaRepository.findAllById(roomIds);
    }

    @Override
    public boolean existsByRoomNumber(String roomNumber) {
        return roomJpaRepository.existsByRoomNumber(roomNumber);
    }

    @Override
    public Room save(Room room) {
        return roomJpaRepository.save(room);
    }
}
