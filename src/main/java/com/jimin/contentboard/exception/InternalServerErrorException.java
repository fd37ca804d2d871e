package com.jimin.contentboard.exception;

import org.springframework.http.HttpStatus;

public class InternalServerErrorException extends ServerErrorException {

    public InternalServerErrorException() {
        this("서버 내부 오류가 발생했습니다");
    }

    public InternalServerErrorException(String message) {
        this(message, null);
    }

    public InternalServerErrorException(String message, String errorCode) {
        super(message, HttpStatus.INTERNAL_SERVER_ERROR, errorCode);
    }
}
