package com.jimin.contentboard.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * 게시글 작성 요청 DTO
 *
 * boardId 형식(양수)만 여기서 검증
 * 실제로 활성 게시판인지는 PostService가 확인 (없으면 400)
 */
public record PostCreateRequest(

        @NotNull(message = "boardId는 필수입니다")
        @Positive(message = "boardId는 양수여야 합니다")
        Long boardId,

        @NotBlank(message = "제목은 필수입니다")
        @Size(max = 200, message = "제목은 최대 200자입니다")
        String title,

        @NotNull(message = "내용은 필수입니다")
        String content
) {
}
