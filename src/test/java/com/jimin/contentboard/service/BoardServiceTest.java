package com.jimin.contentboard.service;

import com.jimin.contentboard.dto.BoardCreateRequest;
import com.jimin.contentboard.dto.BoardResponse;
import com.jimin.contentboard.dto.BoardUpdateRequest;
import com.jimin.contentboard.entity.Board;
import com.jimin.contentboard.exception.BoardNotFoundException;
import com.jimin.contentboard.repository.BoardRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BoardServiceTest {

    @Mock
    private BoardRepository boardRepository;

    @InjectMocks
    private BoardService boardService;

    private static Board board(Long id, String title, String description) {
        LocalDateTime created = LocalDateTime.now().minusDays(1);
        Board board = new Board();
        board.setId(id);
        board.setTitle(title);
        board.setDescription(description);
        board.setCreatedAt(created);
        board.setUpdatedAt(created);
        return board;
    }

    @Test
    void createBoardSavesTitleAndDescription() {
        when(boardRepository.save(any(Board.class))).thenAnswer(invocation -> {
            Board saved = invocation.getArgument(0);
            saved.setId(1L);
            return saved;
        });

        BoardResponse response = boardService.createBoard(new BoardCreateRequest("자유게시판", "아무 이야기나"));

        assertThat(response.id()).isEqualTo(1L);
        assertThat(response.title()).isEqualTo("자유게시판");
        assertThat(response.description()).isEqualTo("아무 이야기나");
        assertThat(response.deletedAt()).isNull();
    }

    @Test
    void getAllBoardsReturnsActiveBoardsInRepositoryOrder() {
        when(boardRepository.findAllByDeletedAtIsNullOrderByIdAsc())
                .thenReturn(List.of(board(1L, "A", "a"), board(3L, "C", "c")));

        List<BoardResponse> boards = boardService.getAllBoards();

        assertThat(boards).extracting(BoardResponse::id).containsExactly(1L, 3L);
    }

    @Test
    void getBoardThrowsNotFoundForMissingOrDeletedBoard() {
        when(boardRepository.findByIdAndDeletedAtIsNull(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> boardService.getBoard(9L))
                .isInstanceOf(BoardNotFoundException.class)
                .hasMessageContaining("9");
    }

    @Test
    void findActiveBoardReturnsEmptyInsteadOfThrowing() {
        when(boardRepository.findByIdAndDeletedAtIsNull(9L)).thenReturn(Optional.empty());

        assertThat(boardService.findActiveBoard(9L)).isEmpty();
    }

    @Test
    void updateBoardChangesOnlyProvidedFields() {
        Board existing = board(1L, "A", "d");
        LocalDateTime createdAt = existing.getCreatedAt();
        when(boardRepository.findByIdAndDeletedAtIsNull(1L)).thenReturn(Optional.of(existing));

        BoardResponse response = boardService.updateBoard(1L, new BoardUpdateRequest("X", null));

        assertThat(response.title()).isEqualTo("X");
        assertThat(response.description()).isEqualTo("d");
        assertThat(response.createdAt()).isEqualTo(createdAt);
    }

    @Test
    void updateBoardTouchesUpdatedAtEvenWithoutChanges() {
        Board existing = board(1L, "A", "d");
        when(boardRepository.findByIdAndDeletedAtIsNull(1L)).thenReturn(Optional.of(existing));

        LocalDateTime before = LocalDateTime.now();
        BoardResponse response = boardService.updateBoard(1L, new BoardUpdateRequest(null, null));
        LocalDateTime after = LocalDateTime.now();

        assertThat(response.title()).isEqualTo("A");
        assertThat(response.description()).isEqualTo("d");
        assertThat(response.updatedAt()).isBetween(before, after);
    }

    @Test
    void updateBoardPropagatesNotFound() {
        when(boardRepository.findByIdAndDeletedAtIsNull(2L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> boardService.updateBoard(2L, new BoardUpdateRequest("X", null)))
                .isInstanceOf(BoardNotFoundException.class);
    }

    @Test
    void deleteBoardSetsDeletedAtAndKeepsOtherFields() {
        Board existing = board(1L, "A", "d");
        LocalDateTime updatedAt = existing.getUpdatedAt();
        when(boardRepository.findByIdAndDeletedAtIsNull(1L)).thenReturn(Optional.of(existing));

        boardService.deleteBoard(1L);

        assertThat(existing.getDeletedAt()).isNotNull();
        assertThat(existing.getId()).isEqualTo(1L);
        assertThat(existing.getTitle()).isEqualTo("A");
        assertThat(existing.getUpdatedAt()).isEqualTo(updatedAt);
    }

    @Test
    void deleteBoardPropagatesNotFound() {
        when(boardRepository.findByIdAndDeletedAtIsNull(1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> boardService.deleteBoard(1L))
                .isInstanceOf(BoardNotFoundException.class);
        verify(boardRepository).findByIdAndDeletedAtIsNull(1L);
    }
}
