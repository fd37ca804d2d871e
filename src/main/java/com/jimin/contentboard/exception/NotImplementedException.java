package com.jimin.contentboard.exception;

import org.springframework.http.HttpStatus;

public class NotImplementedException extends ServerErrorException {

    public NotImplementedException() {
        this("구현되지 않은 기능입니다");
    }

    public NotImplementedException(String message) {
        this(message, null);
    }

    public NotImplementedException(String message, String errorCode) {
        super(message, HttpStatus.NOT_IMPLEMENTED, errorCode);
    }
}
