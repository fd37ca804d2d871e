package com.jimin.contentboard.exception;

import org.springframework.http.HttpStatus;

import java.time.Instant;

/**
 * BaseException - 모든 도메인 예외의 최상위 클래스
 *
 * HTTP 상태 코드를 예외 자체가 들고 다님
 *  → GlobalExceptionHandler는 예외 종류별 분기 없이 getStatus()만 보고 응답 생성
 *
 * 응답 Body 필드:
 *  - message: 사용자에게 보여줄 메시지
 *  - errorCode: 기계가 읽는 에러 코드 (선택, 예: "BOARD_NOT_FOUND")
 *  - statusCode: HTTP 상태 코드
 *  - timestamp: 예외 생성 시각 (ISO 8601)
 */
public abstract class BaseException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;
    private final Instant timestamp;

    protected BaseException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
        this.timestamp = Instant.now();
    }

    public HttpStatus getStatus() {
        return status;
    }

    public int getStatusCode() {
        return status.value();
    }

    /**
     * @return 에러 코드 (없으면 null)
     */
    public String getErrorCode() {
        return errorCode;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * 클라이언트 잘못인지 (4xx)
     */
    public boolean isClientError() {
        int code = getStatusCode();
        return code >= 400 && code < 500;
    }

    /**
     * 서버 잘못인지 (5xx)
     */
    public boolean isServerError() {
        int code = getStatusCode();
        return code >= 500 && code < 600;
    }
}
