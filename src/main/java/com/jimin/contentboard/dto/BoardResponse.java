package com.jimin.contentboard.dto;

import com.jimin.contentboard.entity.Board;

import java.time.LocalDateTime;

/**
 * 게시판 응답 DTO
 *
 * Why: version 같은 내부 컬럼은 응답에서 제외
 */
public record BoardResponse(
        Long id,
        String title,
        String description,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        LocalDateTime deletedAt
) {
    /**
     * Board Entity → BoardResponse 변환
     */
    public static BoardResponse from(Board board) {
        return new BoardResponse(
                board.getId(),
                board.getTitle(),
                board.getDescription(),
                board.getCreatedAt(),
                board.getUpdatedAt(),
                board.getDeletedAt()
        );
    }
}
