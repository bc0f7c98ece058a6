/**
 * 게시글 엔티티, 명령 페이로드, 검증기와 서비스.
 *
 * @since 1.0.0
 */
package com.ryuqq.entityservice.application.post;
