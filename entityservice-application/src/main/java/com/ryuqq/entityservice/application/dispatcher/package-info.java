/**
 * 수신 명령/이벤트 라우팅과 응답 봉투 생성.
 *
 * @since 1.0.0
 */
package com.ryuqq.entityservice.application.dispatcher;
