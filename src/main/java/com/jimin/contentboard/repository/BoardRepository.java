package com.jimin.contentboard.repository;

import com.jimin.contentboard.entity.Board;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * BoardRepository - 게시판 DB 접근 인터페이스
 *
 * soft delete 방식이라 기본 findAll()/findById()는 삭제된 행까지 반환함
 *  → 서비스에서는 아래 DeletedAtIsNull 조건이 붙은 메서드만 사용
 */
@Repository
public interface BoardRepository extends JpaRepository<Board, Long> {

    /**
     * 활성 게시판 전체 (생성순)
     * SELECT * FROM boards WHERE deleted_at IS NULL ORDER BY id ASC
     */
    List<Board> findAllByDeletedAtIsNullOrderByIdAsc();

    /**
     * 활성 게시판 단건
     * SELECT * FROM boards WHERE id = ? AND deleted_at IS NULL
     */
    Optional<Board> findByIdAndDeletedAtIsNull(Long id);
}
