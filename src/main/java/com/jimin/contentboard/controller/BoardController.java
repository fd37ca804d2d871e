package com.jimin.contentboard.controller;

import com.jimin.contentboard.dto.BoardCreateRequest;
import com.jimin.contentboard.dto.BoardResponse;
import com.jimin.contentboard.dto.BoardUpdateRequest;
import com.jimin.contentboard.dto.PostResponse;
import com.jimin.contentboard.service.BoardPostQueryService;
import com.jimin.contentboard.service.BoardService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * BoardController - 게시판 REST API 엔드포인트
 *
 * 에러 응답은 모두 GlobalExceptionHandler가 처리
 */
@RestController
@RequestMapping("/boards")
@RequiredArgsConstructor
@Tag(name = "게시판 API", description = "게시판 CRUD 및 게시판별 게시글 조회 API")
public class BoardController {

    private final BoardService boardService;
    private final BoardPostQueryService boardPostQueryService;

    /**
     * POST /boards
     *
     * 예시 Body: {"title": "자유게시판", "description": "아무 이야기나"}
     * @return 201 Created
     */
    @PostMapping
    @Operation(summary = "게시판 생성")
    public ResponseEntity<BoardResponse> createBoard(@Valid @RequestBody BoardCreateRequest request) {
        BoardResponse savedBoard = boardService.createBoard(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(savedBoard);
    }

    @GetMapping
    @Operation(summary = "게시판 목록 조회", description = "삭제되지 않은 게시판을 생성순으로 반환합니다")
    public ResponseEntity<List<BoardResponse>> getAllBoards() {
        return ResponseEntity.ok(boardService.getAllBoards());
    }

    @GetMapping("/{id}")
    @Operation(summary = "게시판 상세 조회")
    public ResponseEntity<BoardResponse> getBoard(@PathVariable Long id) {
        return ResponseEntity.ok(boardService.getBoard(id));
    }

    /**
     * PUT /boards/{id}
     * 보낸 필드만 수정 (Partial Update)
     */
    @PutMapping("/{id}")
    @Operation(summary = "게시판 수정", description = "보낸 필드만 수정합니다")
    public ResponseEntity<BoardResponse> updateBoard(
            @PathVariable Long id,
            @Valid @RequestBody BoardUpdateRequest request) {
        return ResponseEntity.ok(boardService.updateBoard(id, request));
    }

    /**
     * DELETE /boards/{id}
     * @return 204 No Content
     */
    @DeleteMapping("/{id}")
    @Operation(summary = "게시판 삭제", description = "soft delete, 소속 게시글은 유지됩니다")
    public ResponseEntity<Void> deleteBoard(@PathVariable Long id) {
        boardService.deleteBoard(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/posts")
    @Operation(summary = "게시판별 게시글 조회")
    public ResponseEntity<List<PostResponse>> getPostsOfBoard(@PathVariable Long id) {
        return ResponseEntity.ok(boardPostQueryService.getPostsOfBoard(id));
    }
}
