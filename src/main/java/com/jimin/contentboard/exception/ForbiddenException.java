package com.jimin.contentboard.exception;

import org.springframework.http.HttpStatus;

public class ForbiddenException extends ClientErrorException {

    public ForbiddenException() {
        this("접근 권한이 없습니다");
    }

    public ForbiddenException(String message) {
        this(message, null);
    }

    public ForbiddenException(String message, String errorCode) {
        super(message, HttpStatus.FORBIDDEN, errorCode);
    }
}
