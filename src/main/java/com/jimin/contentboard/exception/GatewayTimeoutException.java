package com.jimin.contentboard.exception;

import org.springframework.http.HttpStatus;

public class GatewayTimeoutException extends ServerErrorException {

    public GatewayTimeoutException() {
        this("게이트웨이 타임아웃이 발생했습니다");
    }

    public GatewayTimeoutException(String message) {
        this(message, null);
    }

    public GatewayTimeoutException(String message, String errorCode) {
        super(message, HttpStatus.GATEWAY_TIMEOUT, errorCode);
    }
}
