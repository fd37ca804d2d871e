package com.jimin.contentboard.exception;

import org.springframework.http.HttpStatus;

/**
 * 5xx 계열 예외 (서버 또는 외부 시스템 문제)
 *
 * 서비스 로직이 직접 던지지는 않음. DB 등 협력 컴포넌트 장애를 감쌀 때 사용
 * 상태 코드를 지정하지 않으면 500 Internal Server Error
 */
public class ServerErrorException extends BaseException {

    public ServerErrorException(String message) {
        this(message, HttpStatus.INTERNAL_SERVER_ERROR, null);
    }

    public ServerErrorException(String message, HttpStatus status, String errorCode) {
        super(message, status, errorCode);
        if (!status.is5xxServerError()) {
            throw new IllegalArgumentException("5xx 상태 코드가 아닙니다: " + status.value());
        }
    }
}
