package com.jimin.contentboard.exception;

import org.springframework.http.HttpStatus;

public class ServiceUnavailableException extends ServerErrorException {

    public ServiceUnavailableException() {
        this("서비스를 사용할 수 없습니다");
    }

    public ServiceUnavailableException(String message) {
        this(message, null);
    }

    public ServiceUnavailableException(String message, String errorCode) {
        super(message, HttpStatus.SERVICE_UNAVAILABLE, errorCode);
    }
}
