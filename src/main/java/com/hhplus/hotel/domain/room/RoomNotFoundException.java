package com.hhplus.hotel.domain.room;

import com.hhplus.hotel.common.exception.DomainException;
import com.hhplus.hotel.common.exception.ErrorCode;

/**
 * 객실을 찾을 수 없을 때 발생하는 예외
 */
public class RoomNotFoundException extends DomainException {

    public RoomNotFoundException(Long roomId) {
        super(ErrorCode.ROOM_NOT_FOUND, "Room ID: " + roomId);
    }
}
