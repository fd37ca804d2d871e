package com.jimin.contentboard.repository;

import com.jimin.contentboard.entity.Post;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * PostRepository - 게시글 DB 접근 인터페이스
 *
 * 메서드 이름 규칙으로 쿼리 자동 생성 (Spring Data JPA)
 *  - DeletedAtIsNull → deleted_at IS NULL (활성 게시글만)
 *  - OrderByIdAsc → 생성순 정렬 (id가 순차 발급되므로)
 */
@Repository
public interface PostRepository extends JpaRepository<Post, Long> {

    List<Post> findAllByDeletedAtIsNullOrderByIdAsc();

    /**
     * 특정 게시판의 활성 게시글
     * SELECT * FROM posts WHERE board_id = ? AND deleted_at IS NULL ORDER BY id ASC
     */
    List<Post> findAllByBoardIdAndDeletedAtIsNullOrderByIdAsc(Long boardId);

    Optional<Post> findByIdAndDeletedAtIsNull(Long id);
}
