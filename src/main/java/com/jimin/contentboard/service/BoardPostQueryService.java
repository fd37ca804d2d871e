package com.jimin.contentboard.service;

import com.jimin.contentboard.dto.PostResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 게시판 → 게시글 조회 전용 Service (GET /boards/{id}/posts)
 *
 * 게시판 자체의 활성 여부는 보지 않음
 *  - 삭제된 게시판의 기존 게시글도 반환
 *  - 없는 게시판이면 빈 목록
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BoardPostQueryService {

    private final PostService postService;

    public List<PostResponse> getPostsOfBoard(Long boardId) {
        return postService.getPosts(boardId);
    }
}
