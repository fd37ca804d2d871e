package com.jimin.contentboard.service;

import com.jimin.contentboard.dto.BoardCreateRequest;
import com.jimin.contentboard.dto.BoardResponse;
import com.jimin.contentboard.dto.BoardUpdateRequest;
import com.jimin.contentboard.entity.Board;
import com.jimin.contentboard.exception.BoardNotFoundException;
import com.jimin.contentboard.repository.BoardRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * BoardService - 게시판 비즈니스 로직 처리
 *
 * 삭제는 soft delete (deletedAt 기록)
 *  - 삭제된 게시판은 목록/단건 조회에서 모두 제외
 *  - 행 자체는 남아 있으므로 ID가 재사용되지 않음
 *
 * @Transactional(readOnly = true): 기본은 읽기 전용, 쓰기 메서드만 개별 지정
 */
@Slf4j
@Service  // Spring Bean으로 등록
@RequiredArgsConstructor  // Lombok: final 필드 자동 생성자 주입
@Transactional(readOnly = true)  // 기본적으로 읽기 전용 트랜잭션
public class BoardService {

    private final BoardRepository boardRepository;  // 자동 주입

    /**
     * 게시판 생성
     * ID, createdAt, updatedAt은 저장 시 자동 설정됨
     */
    @Transactional  // 쓰기 트랜잭션 (readOnly = false)
    public BoardResponse createBoard(BoardCreateRequest request) {
        // 1. DTO → Entity 변환 (id, 시각 필드는 @PrePersist / DB가 채움)
        Board board = new Board();
        board.setTitle(request.title());
        board.setDescription(request.description());

        // 2. DB 저장 → Entity → DTO 변환 후 반환
        Board savedBoard = boardRepository.save(board);
        log.info("게시판 생성: id={}, title={}", savedBoard.getId(), savedBoard.getTitle());
        return BoardResponse.from(savedBoard);
    }

    /**
     * 활성 게시판 전체 조회 (생성순)
     */
    public List<BoardResponse> getAllBoards() {
        return boardRepository.findAllByDeletedAtIsNullOrderByIdAsc()
                .stream()
                .map(BoardResponse::from)
                .toList();
    }

    public BoardResponse getBoard(Long id) {
        return BoardResponse.from(getBoardById(id));
    }

    /**
     * 활성 게시판 조회 (예외 없이 결과만 반환)
     *
     * 게시판이 없다는 사실을 호출하는 쪽에서 다른 의미로 해석해야 할 때 사용
     *  예: 게시글 작성 시 → 404가 아니라 400
     *
     * @return 활성 게시판, 없거나 삭제됐으면 Optional.empty()
     */
    public Optional<Board> findActiveBoard(Long id) {
        return boardRepository.findByIdAndDeletedAtIsNull(id);
    }

    /**
     * ID로 활성 게시판 조회 (내부 로직용)
     *
     * @throws BoardNotFoundException 없거나 삭제된 게시판
     */
    public Board getBoardById(Long id) {
        return findActiveBoard(id)
                .orElseThrow(() -> new BoardNotFoundException(id));
    }

    /**
     * 게시판 수정 (Partial Update)
     *
     * null인 필드는 건너뜀. 바뀐 필드가 없어도 updatedAt은 항상 갱신
     */
    @Transactional
    public BoardResponse updateBoard(Long id, BoardUpdateRequest request) {
        // 1. 기존 게시판 조회 (없으면 404 그대로 전파)
        Board board = getBoardById(id);

        // 2. Partial Update: null인 필드는 건너뜀 → 기존 값 유지
        if (request.title() != null) {
            board.setTitle(request.title());
        }
        if (request.description() != null) {
            board.setDescription(request.description());
        }
        board.setUpdatedAt(LocalDateTime.now());  // 바뀐 필드가 없어도 갱신

        // 3. save() 호출 불필요: 영속 상태 Entity → 커밋 시 Dirty Checking으로 UPDATE
        return BoardResponse.from(board);
    }

    /**
     * 게시판 삭제 (soft delete)
     *
     * 소속 게시글은 건드리지 않음 → 기존 게시글은 계속 조회 가능
     */
    @Transactional
    public void deleteBoard(Long id) {
        Board board = getBoardById(id);
        board.setDeletedAt(LocalDateTime.now());  // DELETE 대신 삭제 시각만 기록
        log.info("게시판 삭제: id={}", id);
    }
}
