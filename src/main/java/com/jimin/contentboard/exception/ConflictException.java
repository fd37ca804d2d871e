package com.jimin.contentboard.exception;

import org.springframework.http.HttpStatus;

// 409: 동시 수정 충돌 등
public class ConflictException extends ClientErrorException {

    public ConflictException() {
        this("리소스 충돌이 발생했습니다");
    }

    public ConflictException(String message) {
        this(message, null);
    }

    public ConflictException(String message, String errorCode) {
        super(message, HttpStatus.CONFLICT, errorCode);
    }
}
