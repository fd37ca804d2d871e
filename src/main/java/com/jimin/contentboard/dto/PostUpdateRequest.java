package com.jimin.contentboard.dto;

import jakarta.validation.constraints.Size;

/**
 * 게시글 수정 요청 DTO
 *
 * Why: CreateRequest와 달리 모든 필드가 선택사항 (Partial Update)
 *      null인 필드는 기존 값을 유지함
 *
 * boardId는 수정 대상이 아님 (게시글 이동 기능 없음)
 */
public record PostUpdateRequest(

        // Why: @NotBlank 없음 → title을 안 보내면 null → 기존 제목 유지
        @Size(max = 200, message = "제목은 최대 200자입니다")
        String title,

        String content
) {
}
