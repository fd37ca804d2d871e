package com.jimin.contentboard.exception;

import org.springframework.http.HttpStatus;

/**
 * 400 Bad Request
 */
public class BadRequestException extends ClientErrorException {

    public BadRequestException() {
        this("잘못된 요청입니다");
    }

    public BadRequestException(String message) {
        this(message, null);
    }

    public BadRequestException(String message, String errorCode) {
        super(message, HttpStatus.BAD_REQUEST, errorCode);
    }
}
