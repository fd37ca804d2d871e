package com.jimin.contentboard.dto;

import jakarta.validation.constraints.Size;

/**
 * 게시판 수정 요청 DTO (Partial Update)
 *
 * 필드를 안 보내거나 null로 보내면 기존 값 유지
 *  {"title": "새 이름"}  → 이름만 변경
 *  {}                   → 아무 필드도 안 바뀌지만 updatedAt은 갱신됨
 */
public record BoardUpdateRequest(

        @Size(max = 200, message = "게시판 이름은 최대 200자입니다")
        String title,

        String description
) {
}
