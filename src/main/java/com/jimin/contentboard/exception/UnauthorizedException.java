package com.jimin.contentboard.exception;

import org.springframework.http.HttpStatus;

public class UnauthorizedException extends ClientErrorException {

    public UnauthorizedException() {
        this("인증이 필요합니다");
    }

    public UnauthorizedException(String message) {
        this(message, null);
    }

    public UnauthorizedException(String message, String errorCode) {
        super(message, HttpStatus.UNAUTHORIZED, errorCode);
    }
}
