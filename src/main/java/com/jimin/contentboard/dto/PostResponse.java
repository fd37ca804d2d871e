package com.jimin.contentboard.dto;

import com.jimin.contentboard.entity.Post;

import java.time.LocalDateTime;

/**
 * 게시글 응답 DTO
 *
 * from() 팩토리 메서드: Post Entity → PostResponse 변환
 */
public record PostResponse(
        Long id,
        Long boardId,
        String title,
        String content,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        LocalDateTime deletedAt
) {
    public static PostResponse from(Post post) {
        return new PostResponse(
                post.getId(),
                post.getBoardId(),
                post.getTitle(),
                post.getContent(),
                post.getCreatedAt(),
                post.getUpdatedAt(),
                post.getDeletedAt()
        );
    }
}
