package com.jimin.contentboard.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ErrorResponse - 표준화된 에러 응답 DTO
 *
 * 모든 API 에러가 이 형식으로 응답
 *
 * 예시 응답:
 * {
 *   "timestamp": "2026-01-21T06:30:00.123Z",
 *   "statusCode": 404,
 *   "error": "Not Found",
 *   "message": "게시판을 찾을 수 없습니다. ID: 999",
 *   "errorCode": "BOARD_NOT_FOUND",
 *   "path": "/boards/999"
 * }
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ErrorResponse {

    /**
     * 에러 발생 시각 (ISO 8601, UTC)
     */
    private String timestamp;

    /**
     * HTTP 상태 코드 (404, 400, 500 등)
     */
    private int statusCode;

    /**
     * HTTP 상태 이름 ("Not Found", "Bad Request" 등)
     */
    private String error;

    private String message;

    /**
     * 기계가 읽는 에러 코드 (없으면 null)
     */
    private String errorCode;

    /**
     * 에러가 발생한 API 경로
     */
    private String path;
}
