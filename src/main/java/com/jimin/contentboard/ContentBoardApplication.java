package com.jimin.contentboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ContentBoardApplication - 게시판 / 게시글 API
 *
 * Features:
 * - Board CRUD (soft delete)
 * - Post CRUD (작성 시 게시판 존재 검증, soft delete)
 * - 게시판별 게시글 조회
 * - Swagger UI (API 문서 자동 생성)
 */
@SpringBootApplication
public class ContentBoardApplication {

	public static void main(String[] args) {
		SpringApplication.run(ContentBoardApplication.class, args);
	}

}
