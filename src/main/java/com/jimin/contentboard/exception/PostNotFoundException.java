package com.jimin.contentboard.exception;

/**
 * PostNotFoundException - 게시글을 찾을 수 없을 때 발생하는 예외
 *
 * RuntimeException 계열(Unchecked)이므로 서비스 메서드 시그니처에 throws 불필요
 * GlobalExceptionHandler가 404 응답으로 변환
 */
public class PostNotFoundException extends NotFoundException {

    public static final String ERROR_CODE = "POST_NOT_FOUND";

    private final Long postId;

    /**
     * @param postId 찾지 못한 게시글 ID
     */
    public PostNotFoundException(Long postId) {
        super("게시글을 찾을 수 없습니다. ID: " + postId, ERROR_CODE);
        this.postId = postId;
    }

    public Long getPostId() {
        return postId;
    }
}
