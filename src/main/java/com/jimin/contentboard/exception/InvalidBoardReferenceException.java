package com.jimin.contentboard.exception;

/**
 * 게시글 작성 시 boardId가 활성 게시판을 가리키지 않을 때 발생
 *
 * 게시판이 없다는 사실은 같지만, 게시글 API 입장에서는
 * "요청한 리소스 없음(404)"이 아니라 "잘못된 입력값(400)"
 */
public class InvalidBoardReferenceException extends BadRequestException {

    public static final String ERROR_CODE = "INVALID_BOARD_REFERENCE";

    private final Long boardId;

    public InvalidBoardReferenceException(Long boardId) {
        super("존재하지 않는 게시판입니다. boardId: " + boardId, ERROR_CODE);
        this.boardId = boardId;
    }

    public Long getBoardId() {
        return boardId;
    }
}
