package com.jimin.contentboard.exception;

import com.jimin.contentboard.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.http.ProblemDetail;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * GlobalExceptionHandler - 전역 예외 처리
 *
 * @RestControllerAdvice: 모든 @RestController에 적용
 * @ExceptionHandler: 특정 Exception 발생 시 자동 호출
 *
 * 도메인 예외(BaseException)는 상태 코드를 직접 들고 있으므로 핸들러 하나로 처리
 * 응답에 스택 트레이스나 내부 예외 메시지는 절대 포함하지 않음
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    public static final String VALIDATION_FAILED = "VALIDATION_FAILED";
    public static final String INVALID_PARAMETER = "INVALID_PARAMETER";
    public static final String MALFORMED_REQUEST = "MALFORMED_REQUEST";
    public static final String CONCURRENT_MODIFICATION = "CONCURRENT_MODIFICATION";
    public static final String NO_SUCH_ENDPOINT = "NO_SUCH_ENDPOINT";
    public static final String METHOD_NOT_ALLOWED = "METHOD_NOT_ALLOWED";
    public static final String UNSUPPORTED_MEDIA_TYPE = "UNSUPPORTED_MEDIA_TYPE";
    public static final String REQUEST_REJECTED = "REQUEST_REJECTED";

    /**
     * 도메인 예외 처리 (404 게시판/게시글 없음, 400 잘못된 boardId 등)
     */
    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ErrorResponse> handleBaseException(
            BaseException ex,
            HttpServletRequest request
    ) {
        if (ex.isServerError()) {
            log.error("서버 오류: {} {}", request.getMethod(), request.getRequestURI(), ex);
        } else {
            log.debug("요청 거부: {} {} → {} {}", request.getMethod(), request.getRequestURI(),
                    ex.getStatusCode(), ex.getMessage());
        }

        ErrorResponse error = new ErrorResponse(
                ex.getTimestamp().toString(),
                ex.getStatusCode(),
                ex.getStatus().getReasonPhrase(),
                ex.getMessage(),
                ex.getErrorCode(),
                request.getRequestURI()
        );

        return ResponseEntity
                .status(ex.getStatus())
                .body(error);
    }

    /**
     * Validation 에러 처리
     * @Valid 검증 실패 시 (예: @NotBlank, @Size)
     *
     * @return 400 Bad Request + ErrorResponse
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationError(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        // 모든 필드 에러를 하나의 메시지로 합침
        String validationErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        return build(HttpStatus.BAD_REQUEST, "입력값 검증 실패: " + validationErrors,
                VALIDATION_FAILED, request);
    }

    /**
     * 경로/쿼리 파라미터 타입 오류
     * 예: GET /boards/abc, GET /posts?boardId=x
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            HttpServletRequest request
    ) {
        return build(HttpStatus.BAD_REQUEST, "잘못된 파라미터입니다: " + ex.getName(),
                INVALID_PARAMETER, request);
    }

    /**
     * JSON 파싱 실패 (Body 누락, 문법 오류, 타입 불일치)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            HttpServletRequest request
    ) {
        return build(HttpStatus.BAD_REQUEST, "요청 본문을 읽을 수 없습니다",
                MALFORMED_REQUEST, request);
    }

    /**
     * 낙관적 락 충돌 (같은 게시판/게시글을 동시에 수정)
     * 나중에 커밋한 쪽이 409를 받음 → 클라이언트가 다시 조회 후 재시도
     */
    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(
            ObjectOptimisticLockingFailureException ex,
            HttpServletRequest request
    ) {
        log.warn("동시 수정 충돌: {} {}", request.getMethod(), request.getRequestURI());
        return build(HttpStatus.CONFLICT, "다른 요청이 먼저 수정했습니다. 다시 조회 후 시도해 주세요",
                CONCURRENT_MODIFICATION, request);
    }

    // 매핑되지 않은 경로 (예: GET /boardz)
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(
            NoResourceFoundException ex,
            HttpServletRequest request
    ) {
        return build(HttpStatus.NOT_FOUND, "존재하지 않는 API 경로입니다",
                NO_SUCH_ENDPOINT, request);
    }

    // 예: PATCH /boards/1
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex,
            HttpServletRequest request
    ) {
        return build(HttpStatus.METHOD_NOT_ALLOWED, "지원하지 않는 HTTP 메서드입니다: " + ex.getMethod(),
                METHOD_NOT_ALLOWED, request);
    }

    // 예: Content-Type: text/plain 으로 POST /boards
    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaTypeNotSupported(
            HttpMediaTypeNotSupportedException ex,
            HttpServletRequest request
    ) {
        return build(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "지원하지 않는 Content-Type입니다: " + ex.getContentType(),
                UNSUPPORTED_MEDIA_TYPE, request);
    }

    /**
     * 그 외 모든 예외 처리 (Fallback)
     *
     * Spring MVC가 상태 코드를 정해 둔 예외(406, 400 파라미터 누락 등)는 그 상태 그대로 응답
     * 나머지는 500 Internal Server Error
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralError(
            Exception ex,
            HttpServletRequest request
    ) {
        // Spring 6: 프레임워크 예외는 org.springframework.web.ErrorResponse 구현 (DTO ErrorResponse와 이름 충돌)
        if (ex instanceof org.springframework.web.ErrorResponse springError) {
            HttpStatus status = HttpStatus.resolve(springError.getStatusCode().value());
            if (status != null && !status.is5xxServerError()) {
                log.debug("요청 거부: {} {} → {}", request.getMethod(), request.getRequestURI(), status.value());
                ProblemDetail detail = springError.getBody();
                String message = detail.getDetail() != null ? detail.getDetail() : status.getReasonPhrase();
                return build(status, message, REQUEST_REJECTED, request);
            }
        }

        log.error("Unexpected error: {} {}", request.getMethod(), request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "서버 내부 오류가 발생했습니다",
                null, request);
    }

    private ResponseEntity<ErrorResponse> build(
            HttpStatus status,
            String message,
            String errorCode,
            HttpServletRequest request
    ) {
        ErrorResponse error = new ErrorResponse(
                Instant.now().toString(),
                status.value(),
                status.getReasonPhrase(),
                message,
                errorCode,
                request.getRequestURI()
        );
        return ResponseEntity.status(status).body(error);
    }
}
