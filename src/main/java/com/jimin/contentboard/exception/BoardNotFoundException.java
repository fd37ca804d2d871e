package com.jimin.contentboard.exception;

/**
 * BoardNotFoundException - 게시판을 찾을 수 없을 때 발생하는 예외
 *
 * 존재하지 않는 ID와 soft delete 된 ID를 구분하지 않음 (둘 다 404)
 */
public class BoardNotFoundException extends NotFoundException {

    public static final String ERROR_CODE = "BOARD_NOT_FOUND";

    private final Long boardId;

    /**
     * @param boardId 찾지 못한 게시판 ID
     */
    public BoardNotFoundException(Long boardId) {
        super("게시판을 찾을 수 없습니다. ID: " + boardId, ERROR_CODE);
        this.boardId = boardId;
    }

    public Long getBoardId() {
        return boardId;
    }
}
