package com.jimin.contentboard.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Post Entity - 게시글 테이블과 매핑
 *
 * DB 테이블: posts
 * 컬럼:
 *  - id: Primary Key (자동 증가)
 *  - boardId: 소속 게시판 ID
 *  - title: 제목 (필수, 최대 200자)
 *  - content: 내용 (TEXT 타입)
 *  - createdAt / updatedAt / deletedAt
 *
 * boardId는 일부러 @ManyToOne이 아닌 단순 컬럼
 *  → 게시판 존재 여부는 작성 시점에만 검사하고,
 *    게시판이 나중에 삭제돼도 게시글은 그대로 조회 가능해야 함
 */
@Entity
@Table(name = "posts", indexes = {
        @Index(name = "idx_posts_board_id", columnList = "board_id")
})
@Data  // Lombok: getter, setter, toString 자동 생성
@NoArgsConstructor
public class Post {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)  // Auto Increment
    private Long id;

    @Column(name = "board_id", nullable = false)  // FK 제약 없음 (작성 시점에만 검증)
    private Long boardId;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "deleted_at")  // null이면 활성 게시글
    private LocalDateTime deletedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
    }
}
