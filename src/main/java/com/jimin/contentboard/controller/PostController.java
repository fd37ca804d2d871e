package com.jimin.contentboard.controller;

import com.jimin.contentboard.dto.PostCreateRequest;
import com.jimin.contentboard.dto.PostResponse;
import com.jimin.contentboard.dto.PostUpdateRequest;
import com.jimin.contentboard.service.PostService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * PostController - 게시글 REST API 엔드포인트
 *
 * @RestController: JSON 응답을 반환하는 컨트롤러
 * @RequestMapping: 모든 API가 /posts로 시작
 * @Tag: Swagger UI에서 API 그룹화
 */
@RestController
@RequestMapping("/posts")
@RequiredArgsConstructor
@Tag(name = "게시글 API", description = "게시글 CRUD API")
public class PostController {

    private final PostService postService;

    /**
     * 게시글 작성
     * POST /posts
     *
     * 예시 요청 Body:
     * {
     *   "boardId": 1,
     *   "title": "새 글",
     *   "content": "내용입니다"
     * }
     *
     * @return 201 Created, boardId가 활성 게시판이 아니면 400 Bad Request
     */
    @PostMapping
    @Operation(summary = "게시글 작성", description = "boardId는 삭제되지 않은 게시판이어야 합니다")
    public ResponseEntity<PostResponse> createPost(@Valid @RequestBody PostCreateRequest request) {
        PostResponse savedPost = postService.createPost(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(savedPost);
    }

    /**
     * 게시글 목록 조회
     * GET /posts
     * GET /posts?boardId=1
     */
    @GetMapping
    @Operation(summary = "게시글 목록 조회", description = "boardId를 주면 해당 게시판 게시글만 반환합니다")
    public ResponseEntity<List<PostResponse>> getPosts(
            @Parameter(description = "게시판 ID (선택)", example = "1")
            @RequestParam(required = false) Long boardId) {
        return ResponseEntity.ok(postService.getPosts(boardId));
    }

    @GetMapping("/{id}")
    @Operation(summary = "게시글 상세 조회")
    public ResponseEntity<PostResponse> getPost(@PathVariable Long id) {
        return ResponseEntity.ok(postService.getPost(id));
    }

    /**
     * 게시글 수정
     * PUT /posts/{id}
     *
     * 예시 Body: {"title": "수정된 제목"} → 내용은 그대로
     */
    @PutMapping("/{id}")
    @Operation(summary = "게시글 수정")
    public ResponseEntity<PostResponse> updatePost(
            @PathVariable Long id,
            @Valid @RequestBody PostUpdateRequest request) {
        return ResponseEntity.ok(postService.updatePost(id, request));
    }

    /**
     * 게시글 삭제
     * DELETE /posts/{id}
     *
     * @return 204 No Content (성공) 또는 404 Not Found
     */
    @DeleteMapping("/{id}")
    @Operation(summary = "게시글 삭제")
    public ResponseEntity<Void> deletePost(@PathVariable Long id) {
        postService.deletePost(id);
        return ResponseEntity.noContent().build();
    }
}
