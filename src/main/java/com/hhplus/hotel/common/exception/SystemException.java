package com.hhplus.hotel.common.exception;

/**
 * SystemException - 시스템/인프라 계층 오류 예외
 *
 * 데이터베이스 등 인프라 오류로 항상 서버 오류(5XX)로 응답한다.
 * 저장소 오류는 재시도 없이 그대로 호출자에게 전달된다.
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode) {
        super(errorCode);
    }

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
