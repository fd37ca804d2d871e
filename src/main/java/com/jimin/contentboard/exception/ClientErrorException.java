package com.jimin.contentboard.exception;

import org.springframework.http.HttpStatus;

/**
 * 4xx 계열 예외 (클라이언트 요청이 잘못된 경우)
 *
 * 상태 코드를 지정하지 않으면 400 Bad Request
 */
public class ClientErrorException extends BaseException {

    public ClientErrorException(String message) {
        this(message, HttpStatus.BAD_REQUEST, null);
    }

    public ClientErrorException(String message, HttpStatus status, String errorCode) {
        super(message, status, errorCode);
        if (!status.is4xxClientError()) {
            throw new IllegalArgumentException("4xx 상태 코드가 아닙니다: " + status.value());
        }
    }
}
