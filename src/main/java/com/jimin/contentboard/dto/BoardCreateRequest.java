package com.jimin.contentboard.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * 게시판 생성 요청 DTO
 *
 * Why: Entity(Board)를 직접 받으면 id, deletedAt 등을 조작할 수 있어서
 *      생성에 필요한 필드(title, description)만 받음
 */
public record BoardCreateRequest(

        @NotBlank(message = "게시판 이름은 필수입니다")
        @Size(max = 200, message = "게시판 이름은 최대 200자입니다")
        String title,

        // 빈 문자열은 허용, 필드 누락(null)만 거부
        @NotNull(message = "게시판 설명은 필수입니다")
        String description
) {
}
