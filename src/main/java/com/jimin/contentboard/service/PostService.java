package com.jimin.contentboard.service;

import com.jimin.contentboard.dto.PostCreateRequest;
import com.jimin.contentboard.dto.PostResponse;
import com.jimin.contentboard.dto.PostUpdateRequest;
import com.jimin.contentboard.entity.Post;
import com.jimin.contentboard.exception.InvalidBoardReferenceException;
import com.jimin.contentboard.exception.PostNotFoundException;
import com.jimin.contentboard.repository.PostRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * PostService - 게시글 비즈니스 로직 처리
 *
 * 게시판 검증은 작성 시점에만 수행
 *  - 작성 후 게시판이 삭제돼도 게시글은 그대로 남고 조회도 가능
 */
@Slf4j
@Service
@RequiredArgsConstructor  // Lombok: final 필드 자동 생성자 주입
@Transactional(readOnly = true)
public class PostService {

    private final PostRepository postRepository;
    private final BoardService boardService;

    /**
     * 게시글 작성
     *
     * @throws InvalidBoardReferenceException boardId가 활성 게시판이 아닐 때 (400)
     */
    @Transactional
    public PostResponse createPost(PostCreateRequest request) {
        // 1. 게시판 존재 확인 (잠금 없는 단순 조회)
        if (boardService.findActiveBoard(request.boardId()).isEmpty()) {
            log.warn("게시글 작성 거부: 존재하지 않는 게시판 boardId={}", request.boardId());
            throw new InvalidBoardReferenceException(request.boardId());
        }

        // 2. DTO → Entity 변환
        Post post = new Post();
        post.setBoardId(request.boardId());
        post.setTitle(request.title());
        post.setContent(request.content());

        // 3. DB 저장 → Entity → DTO 변환 후 반환
        Post savedPost = postRepository.save(post);
        log.info("게시글 작성: id={}, boardId={}", savedPost.getId(), savedPost.getBoardId());
        return PostResponse.from(savedPost);
    }

    /**
     * 활성 게시글 조회 (생성순)
     *
     * @param boardId null이면 전체, 아니면 해당 게시판 게시글만
     */
    public List<PostResponse> getPosts(Long boardId) {
        List<Post> posts = boardId == null
                ? postRepository.findAllByDeletedAtIsNullOrderByIdAsc()
                : postRepository.findAllByBoardIdAndDeletedAtIsNullOrderByIdAsc(boardId);

        return posts.stream()
                .map(PostResponse::from)
                .toList();
    }

    public PostResponse getPost(Long id) {
        return PostResponse.from(getPostById(id));
    }

    /**
     * ID로 활성 게시글 조회 (내부 로직용)
     *
     * @throws PostNotFoundException 없거나 삭제된 게시글
     */
    public Post getPostById(Long id) {
        return postRepository.findByIdAndDeletedAtIsNull(id)
                .orElseThrow(() -> new PostNotFoundException(id));
    }

    /**
     * 게시글 수정 (Partial Update)
     * null인 필드는 기존 값 유지, updatedAt은 항상 갱신
     */
    @Transactional
    public PostResponse updatePost(Long id, PostUpdateRequest request) {
        Post post = getPostById(id);

        if (request.title() != null) {
            post.setTitle(request.title());
        }
        if (request.content() != null) {
            post.setContent(request.content());
        }
        post.setUpdatedAt(LocalDateTime.now());

        return PostResponse.from(post);
    }

    /**
     * 게시글 삭제 (soft delete)
     */
    @Transactional
    public void deletePost(Long id) {
        Post post = getPostById(id);
        post.setDeletedAt(LocalDateTime.now());
        log.info("게시글 삭제: id={}", id);
    }
}
