package com.jimin.contentboard.exception;

import org.springframework.http.HttpStatus;

/**
 * 404 Not Found
 *
 * 요청한 리소스가 없거나 soft delete 된 경우
 */
public class NotFoundException extends ClientErrorException {

    public NotFoundException() {
        this("리소스를 찾을 수 없습니다");
    }

    public NotFoundException(String message) {
        this(message, null);
    }

    public NotFoundException(String message, String errorCode) {
        super(message, HttpStatus.NOT_FOUND, errorCode);
    }
}
