package com.jimin.contentboard.service;

import com.jimin.contentboard.dto.BoardCreateRequest;
import com.jimin.contentboard.dto.BoardUpdateRequest;
import com.jimin.contentboard.entity.Board;
import com.jimin.contentboard.repository.BoardRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 같은 게시판을 두 트랜잭션이 겹쳐서 수정할 때
 * 먼저 커밋한 쪽만 반영되고 나중 쪽은 커밋 시점에 실패해야 함 (@Version)
 */
@SpringBootTest
@ActiveProfiles("test")
class BoardOptimisticLockTest {

    @Autowired
    private BoardService boardService;

    @Autowired
    private BoardRepository boardRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private ExecutorService otherWriter;

    @BeforeEach
    void setUp() {
        otherWriter = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        otherWriter.shutdown();
        otherWriter.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void laterWriterOfStaleBoardFailsAtCommit() {
        Long id = boardService.createBoard(new BoardCreateRequest("원래 이름", "d")).id();
        TransactionTemplate transaction = new TransactionTemplate(transactionManager);

        assertThatThrownBy(() -> transaction.executeWithoutResult(status -> {
            // 1. 이 트랜잭션이 version=0 상태의 게시판을 읽어 둠
            Board stale = boardRepository.findById(id).orElseThrow();

            // 2. 다른 스레드(= 다른 트랜잭션)가 먼저 수정하고 커밋 → version=1
            try {
                otherWriter.submit(() -> boardService.updateBoard(id, new BoardUpdateRequest("먼저 수정", null)))
                        .get(5, TimeUnit.SECONDS);
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }

            // 3. 오래된 사본을 수정 → 커밋 시 UPDATE ... WHERE version=0 이 0건
            stale.setTitle("나중 수정");
        })).isInstanceOf(ObjectOptimisticLockingFailureException.class);

        assertThat(boardService.getBoard(id).title()).isEqualTo("먼저 수정");
    }

    @Test
    void sequentialUpdatesDoNotConflict() {
        Long id = boardService.createBoard(new BoardCreateRequest("A", "d")).id();

        boardService.updateBoard(id, new BoardUpdateRequest("B", null));
        boardService.updateBoard(id, new BoardUpdateRequest("C", null));

        assertThat(boardService.getBoard(id).title()).isEqualTo("C");
        assertThat(boardRepository.findById(id)).hasValueSatisfying(board ->
                assertThat(board.getVersion()).isEqualTo(2L));
    }
}
