package com.jimin.contentboard.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Board Entity - 게시판 테이블과 매핑
 *
 * DB 테이블: boards
 * 컬럼:
 *  - id: Primary Key (자동 증가, 1부터 순차 발급, 재사용 없음)
 *  - title: 게시판 이름 (필수, 최대 200자)
 *  - description: 게시판 설명
 *  - createdAt / updatedAt: 작성일 / 마지막 수정일
 *  - deletedAt: 삭제일 (null이면 활성 게시판)
 *  - version: 낙관적 락 (동시 수정 감지용)
 */
@Entity  // 이 클래스가 DB 테이블과 매핑됨
@Table(name = "boards")  // 테이블 이름 지정
@Data  // Lombok: getter, setter, toString 자동 생성
@NoArgsConstructor  // Lombok: 기본 생성자 (JPA 필수)
public class Board {

    @Id  // Primary Key
    @GeneratedValue(strategy = GenerationType.IDENTITY)  // Auto Increment (MySQL)
    private Long id;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(columnDefinition = "TEXT")  // TEXT 타입 (긴 문자열)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)  // 수정 불가
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    // Why: 행을 지우지 않고 삭제 시각만 기록 (soft delete)
    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    @Version  // UPDATE 시 version 조건 + 1 증가
    private Long version;

    /**
     * 최초 저장 직전에 생성일/수정일을 같은 시각으로 설정
     */
    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
    }
}
