package com.hhplus.hotel.domain.room;

import com.hhplus.hotel.common.exception.DomainException;
import com.hhplus.hotel.common.exception.ErrorCode;

/**
 * 이미 존재하는 객실 번호로 객실을 등록하려 할 때 발생하는 예외
 */
public class DuplicateRoomNumberException extends DomainException {

    public DuplicateRoomNumberException(String roomNumber) {
        super(ErrorCode.DUPLICATE_ROOM_NUMBER, "객실 번호: " + roomNumber);
    }
}
